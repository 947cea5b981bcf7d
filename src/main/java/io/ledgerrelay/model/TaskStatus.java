package io.ledgerrelay.model;

public enum TaskStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    RETRYING,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
