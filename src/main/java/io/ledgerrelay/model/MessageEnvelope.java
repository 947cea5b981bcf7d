package io.ledgerrelay.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.ledgerrelay.config.LedgerRelayConfig;
import io.ledgerrelay.util.Jsons;

import java.nio.charset.StandardCharsets;

import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

public record MessageEnvelope(
        String msgId,
        String topic,
        MessageKind kind,
        String taskType,
        String dedupKey,
        boolean scheduled,
        int attempt,
        long createdAtMs,
        JsonNode payload
) {
    public static final String LEDGER_EVENT_TASK_TYPE = "process_ledger_event";
    private static final Pattern TOPIC_PATTERN = Pattern.compile("[a-z0-9][a-z0-9._-]{0,63}");

    public static MessageEnvelope task(String topic, String taskType, JsonNode payload, String dedupKey, boolean scheduled) {
        String msgId = newMsgId();
        return new MessageEnvelope(
                msgId,
                topic,
                MessageKind.TASK,
                taskType,
                dedupKey == null || dedupKey.isBlank() ? msgId : dedupKey,
                scheduled,
                1,
                Instant.now().toEpochMilli(),
                payload == null ? Jsons.mapper().createObjectNode() : payload
        );
    }

    public static MessageEnvelope ledgerEvent(String topic, LedgerEvent event) {
        return new MessageEnvelope(
                newMsgId(),
                topic,
                MessageKind.LEDGER_EVENT,
                LEDGER_EVENT_TASK_TYPE,
                "ledger:" + event.eventId(),
                false,
                1,
                Instant.now().toEpochMilli(),
                Jsons.mapper().valueToTree(event)
        );
    }

    public MessageEnvelope redelivery(int nextAttempt) {
        return new MessageEnvelope(
                newMsgId(),
                topic,
                kind,
                taskType,
                dedupKey,
                scheduled,
                nextAttempt,
                Instant.now().toEpochMilli(),
                payload
        );
    }

    public LedgerEvent asLedgerEvent() {
        if (kind != MessageKind.LEDGER_EVENT) {
            throw new IllegalStateException("message " + msgId + " is not a ledger event");
        }
        try {
            return Jsons.mapper().treeToValue(payload, LedgerEvent.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("ledger event payload does not match schema: " + msgId, e);
        }
    }

    public void validate() {
        if (msgId == null || msgId.isBlank()) {
            throw new IllegalArgumentException("message requires msgId");
        }
        if (topic == null || !TOPIC_PATTERN.matcher(topic).matches()) {
            throw new IllegalArgumentException("invalid topic for message " + msgId + ": " + topic);
        }
        if (kind == null) {
            throw new IllegalArgumentException("message requires kind: " + msgId);
        }
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("message requires taskType: " + msgId);
        }
        if (dedupKey == null || dedupKey.isBlank()) {
            throw new IllegalArgumentException("message requires dedupKey: " + msgId);
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("message attempt must be >= 1: " + msgId);
        }
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("message payload must be a JSON object: " + msgId);
        }
        long payloadBytes = payload.toString().getBytes(StandardCharsets.UTF_8).length;
        if (payloadBytes > LedgerRelayConfig.DEFAULT_PAYLOAD_MAX_BYTES) {
            throw new IllegalArgumentException("message payload too large: " + payloadBytes + " bytes, max="
                    + LedgerRelayConfig.DEFAULT_PAYLOAD_MAX_BYTES + ": " + msgId);
        }
        if (kind == MessageKind.LEDGER_EVENT) {
            LedgerEvent event = asLedgerEvent();
            event.validate();
            if (!dedupKey.equals("ledger:" + event.eventId())) {
                throw new IllegalArgumentException("ledger event dedupKey does not match eventId: " + msgId);
            }
        }
    }

    private static String newMsgId() {
        return "msg_" + UUID.randomUUID();
    }
}
