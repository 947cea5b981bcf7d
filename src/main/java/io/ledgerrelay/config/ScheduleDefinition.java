package io.ledgerrelay.config;

import com.fasterxml.jackson.databind.JsonNode;

public record ScheduleDefinition(
        String name,
        String taskType,
        long intervalMs,
        JsonNode payload
) {
    public ScheduleDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("schedule name must not be blank");
        }
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("schedule taskType must not be blank: " + name);
        }
        if (intervalMs < 1_000L) {
            throw new IllegalArgumentException("schedule intervalMs must be >= 1000: " + name);
        }
    }

    public long windowStart(long nowMs) {
        return (nowMs / intervalMs) * intervalMs;
    }
}
