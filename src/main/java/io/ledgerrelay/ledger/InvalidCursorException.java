package io.ledgerrelay.ledger;

public class InvalidCursorException extends LedgerException {
    private final String cursor;

    public InvalidCursorException(String cursor, String message) {
        super(message);
        this.cursor = cursor;
    }

    public String cursor() {
        return cursor;
    }
}
