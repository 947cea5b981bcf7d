package io.ledgerrelay.ledger;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

public record LedgerTransaction(
        String id,
        String pagingToken,
        String hash,
        long ledger,
        String createdAt,
        String sourceAccount,
        String memoType,
        String memo,
        boolean successful,
        JsonNode raw
) {
    public static LedgerTransaction fromJson(JsonNode node) {
        return new LedgerTransaction(
                text(node, "id"),
                text(node, "paging_token"),
                text(node, "hash"),
                node.path("ledger").asLong(0L),
                text(node, "created_at"),
                text(node, "source_account"),
                text(node, "memo_type"),
                text(node, "memo"),
                node.path("successful").asBoolean(true),
                node
        );
    }

    public void validate() {
        if (id == null || id.isBlank()) {
            throw new MalformedTransactionException("transaction record has no id (paging_token=" + pagingToken + ")");
        }
        if (hash == null || hash.isBlank()) {
            throw new MalformedTransactionException("transaction " + id + " has no hash");
        }
        if (parsePosition(pagingToken) < 0L) {
            throw new MalformedTransactionException("transaction " + id + " has invalid paging_token: " + pagingToken);
        }
        if (createdAt == null) {
            throw new MalformedTransactionException("transaction " + id + " has no created_at");
        }
        try {
            OffsetDateTime.parse(createdAt);
        } catch (DateTimeParseException e) {
            throw new MalformedTransactionException("transaction " + id + " has invalid created_at: " + createdAt);
        }
    }

    public long position() {
        return parsePosition(pagingToken);
    }

    public static long parsePosition(String pagingToken) {
        if (pagingToken == null || pagingToken.isBlank()) {
            return -1L;
        }
        try {
            long value = Long.parseLong(pagingToken.trim());
            return value < 0L ? -1L : value;
        } catch (NumberFormatException e) {
            return -1L;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
