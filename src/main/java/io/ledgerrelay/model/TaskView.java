package io.ledgerrelay.model;

public record TaskView(
        String taskId,
        String taskType,
        String dedupKey,
        String status,
        int attempt,
        int maxAttempts,
        String payload,
        String result,
        String lastError,
        Long nextRetryAtMs,
        long createdAtMs,
        long updatedAtMs
) {
}
