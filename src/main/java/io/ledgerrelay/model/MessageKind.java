package io.ledgerrelay.model;

public enum MessageKind {
    LEDGER_EVENT,
    TASK
}
