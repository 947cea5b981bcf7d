package io.ledgerrelay.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.ledgerrelay.ledger.LedgerTransaction;

public record LedgerEvent(
        String eventId,
        String cursor,
        long ledger,
        String hash,
        String sourceAccount,
        String memoType,
        String memo,
        String createdAt,
        long observedAtMs,
        JsonNode payload
) {
    public static LedgerEvent from(LedgerTransaction tx, long observedAtMs) {
        return new LedgerEvent(
                tx.id(),
                tx.pagingToken(),
                tx.ledger(),
                tx.hash(),
                tx.sourceAccount(),
                tx.memoType(),
                tx.memo(),
                tx.createdAt(),
                observedAtMs,
                tx.raw()
        );
    }

    public void validate() {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("ledger event requires eventId");
        }
        if (cursor == null || cursor.isBlank()) {
            throw new IllegalArgumentException("ledger event requires cursor: " + eventId);
        }
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("ledger event requires hash: " + eventId);
        }
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("ledger event requires object payload: " + eventId);
        }
    }
}
