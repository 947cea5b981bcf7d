package io.ledgerrelay.task;

public class TaskExecutionException extends RuntimeException {
    private final boolean retryable;

    public TaskExecutionException(String message) {
        this(message, true, null);
    }

    public TaskExecutionException(String message, Throwable cause) {
        this(message, true, cause);
    }

    public TaskExecutionException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
