package io.ledgerrelay.ledger;

public class ConnectivityException extends LedgerException {

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
