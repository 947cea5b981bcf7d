package io.ledgerrelay.watcher;

import io.ledgerrelay.bus.Broker;
import io.ledgerrelay.bus.BrokerUnavailableException;
import io.ledgerrelay.ledger.ConnectivityException;
import io.ledgerrelay.ledger.InvalidCursorException;
import io.ledgerrelay.ledger.LedgerTransaction;
import io.ledgerrelay.ledger.MalformedTransactionException;
import io.ledgerrelay.ledger.TransactionFeed;
import io.ledgerrelay.model.LedgerEvent;
import io.ledgerrelay.model.MessageEnvelope;
import io.ledgerrelay.observability.AuditLogger;
import io.ledgerrelay.storage.CheckpointStore;
import io.ledgerrelay.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * Follows the ledger transaction feed from a durable checkpoint and publishes one event per
 * transaction of interest.
 *
 * <p>For every record the order is: validate, filter, publish, then persist the cursor. A
 * crash between publish and persist re-reads the record on restart, so delivery is
 * at-least-once and consumers deduplicate on the event id.
 *
 * <p>While the broker is unavailable, events and cursor advances queue up in a bounded
 * buffer in read order. A full buffer stops reading until a flush succeeds. The checkpoint
 * never passes an event that has not been published.
 *
 * <p>Not thread-safe: one watcher instance runs on one thread.
 */
public final class LedgerWatcher {
    private static final Logger log = LoggerFactory.getLogger(LedgerWatcher.class);

    private final TransactionFeed feed;
    private final Broker broker;
    private final CheckpointStore checkpoints;
    private final Predicate<LedgerTransaction> interest;
    private final WatcherOptions options;
    private final Sleeper sleeper;
    private final LongSupplier clock;
    private final AuditLogger auditLogger;
    private final PublishBuffer buffer;

    private volatile boolean running = true;
    private boolean resumed;
    private String readCursor;

    public LedgerWatcher(TransactionFeed feed, Broker broker, CheckpointStore checkpoints,
                         Predicate<LedgerTransaction> interest, WatcherOptions options,
                         Sleeper sleeper, LongSupplier clock, AuditLogger auditLogger) {
        this.feed = feed;
        this.broker = broker;
        this.checkpoints = checkpoints;
        this.interest = interest;
        this.options = options;
        this.sleeper = sleeper;
        this.clock = clock;
        this.auditLogger = auditLogger;
        this.buffer = new PublishBuffer(options.bufferCapacity());
    }

    public String resume() {
        readCursor = checkpoints.load(options.watcherId())
                .map(CheckpointStore.Checkpoint::cursor)
                .orElse(null);
        resumed = true;
        log.info("Watcher {} resuming after cursor {}", options.watcherId(), readCursor == null ? "<oldest>" : readCursor);
        return readCursor;
    }

    public void run() {
        if (!resumed) {
            resume();
        }
        while (running && !Thread.currentThread().isInterrupted()) {
            WatchOutcome outcome;
            try {
                outcome = pollOnce();
            } catch (WatcherStoppedException e) {
                log.info("{}", e.getMessage());
                break;
            } catch (ConnectivityException e) {
                if (running) {
                    throw e;
                }
                break;
            }
            if (outcome.fetched() < options.pageLimit() && !pause(options.pollIntervalMs())) {
                break;
            }
        }
        log.info("Watcher {} stopped at read cursor {}, {} buffered", options.watcherId(), readCursor, buffer.size());
    }

    public void stop() {
        running = false;
    }

    public WatchOutcome pollOnce() {
        if (!resumed) {
            resume();
        }
        if (!buffer.isEmpty() && !tryFlush() && buffer.isFull()) {
            awaitRoom();
        }
        String fromCursor = readCursor;
        PageFetch page = fetchPage(readCursor);
        int published = 0;
        int skipped = 0;
        int malformed = 0;
        int buffered = 0;
        for (LedgerTransaction tx : page.records()) {
            switch (onTransaction(tx)) {
                case PUBLISHED -> published++;
                case SKIPPED -> skipped++;
                case MALFORMED -> malformed++;
                case BUFFERED -> buffered++;
            }
        }
        String persisted = checkpoints.load(options.watcherId()).map(CheckpointStore.Checkpoint::cursor).orElse(null);
        return new WatchOutcome(
                options.watcherId(),
                fromCursor,
                readCursor,
                persisted,
                page.records().size(),
                published,
                skipped,
                malformed,
                buffered,
                buffer.size(),
                page.resynced()
        );
    }

    public Disposition onTransaction(LedgerTransaction tx) {
        try {
            tx.validate();
        } catch (MalformedTransactionException e) {
            log.warn("Skipping malformed ledger record: {}", e.getMessage());
            if (tx.position() >= 0L) {
                advance(tx.pagingToken());
            }
            return Disposition.MALFORMED;
        }
        if (!interest.test(tx)) {
            advance(tx.pagingToken());
            return Disposition.SKIPPED;
        }
        LedgerEvent event = LedgerEvent.from(tx, clock.getAsLong());
        MessageEnvelope envelope = MessageEnvelope.ledgerEvent(options.topic(), event);
        if (!buffer.isEmpty()) {
            bufferEvent(envelope, tx.pagingToken());
            return Disposition.BUFFERED;
        }
        try {
            broker.publish(options.topic(), envelope);
        } catch (BrokerUnavailableException e) {
            log.warn("Broker unavailable, buffering event {}: {}", event.eventId(), e.getMessage());
            readCursor = tx.pagingToken();
            buffer.addEvent(envelope, tx.pagingToken());
            return Disposition.BUFFERED;
        }
        persist(tx.pagingToken());
        return Disposition.PUBLISHED;
    }

    public int bufferedCount() {
        return buffer.size();
    }

    public String readCursor() {
        return readCursor;
    }

    public boolean tryFlush() {
        int flushed = 0;
        while (!buffer.isEmpty()) {
            PublishBuffer.Entry head = buffer.peek();
            if (head.envelope() != null) {
                try {
                    broker.publish(options.topic(), head.envelope());
                } catch (BrokerUnavailableException e) {
                    log.debug("Broker still unavailable, {} entries buffered: {}", buffer.size(), e.getMessage());
                    return false;
                }
                flushed++;
            }
            checkpoints.advance(options.watcherId(), head.cursor(), clock.getAsLong());
            buffer.removeHead();
        }
        if (flushed > 0) {
            log.info("Flushed {} buffered ledger event(s) for watcher {}", flushed, options.watcherId());
        }
        return true;
    }

    private void advance(String cursor) {
        readCursor = cursor;
        if (buffer.isEmpty()) {
            checkpoints.advance(options.watcherId(), cursor, clock.getAsLong());
            return;
        }
        if (buffer.isFull()) {
            awaitRoom();
        }
        if (buffer.isEmpty()) {
            checkpoints.advance(options.watcherId(), cursor, clock.getAsLong());
        } else {
            buffer.addCursor(cursor);
        }
    }

    private void persist(String cursor) {
        readCursor = cursor;
        checkpoints.advance(options.watcherId(), cursor, clock.getAsLong());
    }

    private void bufferEvent(MessageEnvelope envelope, String cursor) {
        readCursor = cursor;
        if (buffer.isFull()) {
            awaitRoom();
        }
        if (buffer.isEmpty() && tryPublish(envelope)) {
            checkpoints.advance(options.watcherId(), cursor, clock.getAsLong());
            return;
        }
        buffer.addEvent(envelope, cursor);
    }

    private boolean tryPublish(MessageEnvelope envelope) {
        try {
            broker.publish(options.topic(), envelope);
            return true;
        } catch (BrokerUnavailableException e) {
            log.debug("Broker unavailable: {}", e.getMessage());
            return false;
        }
    }

    // Blocks reading until a flush frees room in the buffer.
    private void awaitRoom() {
        log.warn("Publish buffer full ({} entries), pausing ledger reads until the broker recovers", buffer.capacity());
        int attempt = 0;
        while (!tryFlush()) {
            attempt++;
            if (!running || !pause(options.backoff().delayMs(attempt))) {
                throw new WatcherStoppedException("Watcher stopped while the publish buffer was full");
            }
        }
    }

    private PageFetch fetchPage(String cursor) {
        String current = cursor;
        boolean resynced = false;
        int failures = 0;
        while (true) {
            try {
                List<LedgerTransaction> records = feed.fetch(current, options.pageLimit());
                if (resynced) {
                    readCursor = current;
                }
                return new PageFetch(records, resynced);
            } catch (ConnectivityException e) {
                failures++;
                long delay = options.backoff().delayMs(failures);
                log.warn("Ledger feed unreachable (attempt {}), retrying in {} ms: {}", failures, delay, e.getMessage());
                if (!running || !pause(delay)) {
                    throw e;
                }
            } catch (InvalidCursorException e) {
                String next = resyncTarget(current);
                if (resynced && equalsCursor(next, current)) {
                    throw e;
                }
                log.warn("Ledger rejected cursor {}, resynchronizing from {}", current, next == null ? "<oldest>" : next);
                audit("ledger.resync", "cursor:" + current, Map.of(
                        "rejected_cursor", String.valueOf(current),
                        "resync_cursor", next == null ? "" : next,
                        "reason", String.valueOf(e.getMessage())
                ));
                current = next;
                resynced = true;
            }
        }
    }

    private String resyncTarget(String rejected) {
        String configured = options.resyncCursor();
        if (configured != null && !configured.isBlank() && !configured.equals(rejected)) {
            return configured;
        }
        return null;
    }

    private static boolean equalsCursor(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    private boolean pause(long millis) {
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
            return false;
        }
    }

    private void audit(String action, String resource, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>(details);
        row.put("watcher_id", options.watcherId());
        auditLogger.log(AuditLogger.AuditEvent.of(action, "watcher", resource, "ok", null, row));
    }

    public enum Disposition {
        PUBLISHED,
        SKIPPED,
        MALFORMED,
        BUFFERED
    }

    private record PageFetch(List<LedgerTransaction> records, boolean resynced) {
    }
}
