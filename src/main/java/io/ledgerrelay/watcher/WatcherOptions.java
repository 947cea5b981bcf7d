package io.ledgerrelay.watcher;

import io.ledgerrelay.config.LedgerRelayConfig;
import io.ledgerrelay.config.RuntimeSettings;
import io.ledgerrelay.util.Backoff;

public record WatcherOptions(
        String watcherId,
        String topic,
        int pageLimit,
        long pollIntervalMs,
        String resyncCursor,
        int bufferCapacity,
        Backoff backoff
) {
    public static WatcherOptions from(RuntimeSettings settings) {
        return new WatcherOptions(
                settings.watcherId(),
                LedgerRelayConfig.LEDGER_TOPIC,
                settings.pageLimit(),
                settings.pollIntervalMs(),
                settings.resyncCursor(),
                settings.publishBufferCapacity(),
                new Backoff(settings.connectBaseBackoffMs(), settings.connectMaxBackoffMs())
        );
    }
}
