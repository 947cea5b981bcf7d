package io.ledgerrelay.task;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ledgerrelay.util.Jsons;

import java.time.Instant;

public final class EchoHandler implements TaskHandler {
    public static final String TYPE = "echo";

    @Override
    public String taskType() {
        return TYPE;
    }

    @Override
    public TaskResult execute(TaskContext context) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("handler", TYPE);
        out.put("timestamp", Instant.now().toString());
        out.put("taskId", context.taskId());
        out.put("attempt", context.attempt());
        out.set("received", context.payload());
        return TaskResult.ok(out);
    }
}
