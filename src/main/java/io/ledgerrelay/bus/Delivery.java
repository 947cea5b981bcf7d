package io.ledgerrelay.bus;

import io.ledgerrelay.model.MessageEnvelope;

import java.nio.file.Path;

public record Delivery(MessageEnvelope envelope, String consumerId, Path processingFile) {
}
