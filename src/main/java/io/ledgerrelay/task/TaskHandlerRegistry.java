package io.ledgerrelay.task;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class TaskHandlerRegistry {
    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    public TaskHandlerRegistry register(TaskHandler handler) {
        handlers.put(handler.taskType(), handler);
        return this;
    }

    public Optional<TaskHandler> findByType(String taskType) {
        return Optional.ofNullable(handlers.get(taskType));
    }

    public Collection<String> listTaskTypes() {
        return new TreeSet<>(handlers.keySet());
    }
}
