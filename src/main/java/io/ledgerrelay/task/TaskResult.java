package io.ledgerrelay.task;

import com.fasterxml.jackson.databind.JsonNode;

public record TaskResult(
        boolean success,
        JsonNode output,
        String error,
        boolean retryable
) {
    public static TaskResult ok(JsonNode output) {
        return new TaskResult(true, output, null, false);
    }

    public static TaskResult fail(String error) {
        return new TaskResult(false, null, error, true);
    }

    public static TaskResult fatal(String error) {
        return new TaskResult(false, null, error, false);
    }
}
