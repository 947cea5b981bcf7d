package io.ledgerrelay.task;

public interface TaskHandler {
    String taskType();

    TaskResult execute(TaskContext context) throws Exception;
}
