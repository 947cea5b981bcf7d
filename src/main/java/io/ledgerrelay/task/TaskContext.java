package io.ledgerrelay.task;

import com.fasterxml.jackson.databind.JsonNode;
import io.ledgerrelay.model.LedgerEvent;
import io.ledgerrelay.model.MessageEnvelope;

public record TaskContext(
        String taskId,
        int attempt,
        int maxAttempts,
        MessageEnvelope envelope
) {
    public String taskType() {
        return envelope.taskType();
    }

    public JsonNode payload() {
        return envelope.payload();
    }

    public LedgerEvent ledgerEvent() {
        return envelope.asLedgerEvent();
    }
}
