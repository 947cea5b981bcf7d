package io.ledgerrelay.watcher;

public record WatchOutcome(
        String watcherId,
        String fromCursor,
        String readCursor,
        String checkpointCursor,
        int fetched,
        int published,
        int skipped,
        int malformed,
        int buffered,
        int bufferSize,
        boolean resynced
) {
}
