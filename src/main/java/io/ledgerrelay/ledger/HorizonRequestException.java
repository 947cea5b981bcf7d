package io.ledgerrelay.ledger;

public class HorizonRequestException extends LedgerException {
    private final int status;

    public HorizonRequestException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
