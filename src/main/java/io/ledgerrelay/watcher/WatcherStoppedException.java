package io.ledgerrelay.watcher;

public class WatcherStoppedException extends RuntimeException {

    public WatcherStoppedException(String message) {
        super(message);
    }
}
