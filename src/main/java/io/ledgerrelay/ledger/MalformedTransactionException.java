package io.ledgerrelay.ledger;

public class MalformedTransactionException extends LedgerException {

    public MalformedTransactionException(String message) {
        super(message);
    }
}
