package io.ledgerrelay.bus;

import com.fasterxml.jackson.databind.JsonNode;

public record DeadLetter(String file, long movedAtMs, JsonNode message) {
}
