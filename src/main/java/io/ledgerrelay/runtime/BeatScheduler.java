package io.ledgerrelay.runtime;

import io.ledgerrelay.bus.Broker;
import io.ledgerrelay.bus.BrokerUnavailableException;
import io.ledgerrelay.config.LedgerRelayConfig;
import io.ledgerrelay.config.ScheduleDefinition;
import io.ledgerrelay.model.MessageEnvelope;
import io.ledgerrelay.observability.AuditLogger;
import io.ledgerrelay.storage.ScheduleStore;
import io.ledgerrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

public final class BeatScheduler {
    private static final Logger log = LoggerFactory.getLogger(BeatScheduler.class);
    private static final int OUTBOX_BATCH = 100;

    private final ScheduleStore scheduleStore;
    private final Broker broker;
    private final Supplier<List<ScheduleDefinition>> definitions;
    private final LongSupplier clock;
    private final AuditLogger auditLogger;
    private List<ScheduleDefinition> synced;
    private boolean started;

    public BeatScheduler(ScheduleStore scheduleStore, Broker broker, Supplier<List<ScheduleDefinition>> definitions,
                         LongSupplier clock, AuditLogger auditLogger) {
        this.scheduleStore = scheduleStore;
        this.broker = broker;
        this.definitions = definitions;
        this.clock = clock;
        this.auditLogger = auditLogger;
    }

    public int start() {
        syncIfChanged();
        started = true;
        int republished = flushOutbox();
        if (republished > 0) {
            log.info("Published {} outbox row(s) left over from a previous run", republished);
        }
        return republished;
    }

    public TickOutcome tick() {
        return tick(clock.getAsLong());
    }

    public TickOutcome tick(long nowMs) {
        if (!started) {
            start();
        } else {
            syncIfChanged();
        }
        int fired = 0;
        int published = 0;
        for (ScheduleDefinition def : synced) {
            long windowStart = def.windowStart(nowMs);
            String dedupKey = "schedule:" + def.name() + ":" + windowStart;
            MessageEnvelope envelope = MessageEnvelope.task(LedgerRelayConfig.TASKS_TOPIC, def.taskType(),
                    def.payload() == null ? null : def.payload().deepCopy(), dedupKey, true);
            var row = scheduleStore.tryFire(def.name(), windowStart, dedupKey, Jsons.toCompactJson(envelope), nowMs);
            if (row.isEmpty()) {
                continue;
            }
            fired++;
            log.info("Schedule {} fired for window {}", def.name(), windowStart);
            audit(def, windowStart, dedupKey);
            if (publish(row.get(), nowMs)) {
                published++;
            }
        }
        return new TickOutcome(nowMs, fired, published);
    }

    // Stops at the first broker failure and leaves the rest for the next call.
    public int flushOutbox() {
        int published = 0;
        long now = clock.getAsLong();
        for (ScheduleStore.OutboxRow row : scheduleStore.pendingOutbox(OUTBOX_BATCH)) {
            if (!publish(row, now)) {
                break;
            }
            published++;
        }
        return published;
    }

    private boolean publish(ScheduleStore.OutboxRow row, long nowMs) {
        MessageEnvelope envelope;
        try {
            envelope = Jsons.mapper().readValue(row.envelopeJson(), MessageEnvelope.class);
        } catch (IOException e) {
            throw new RuntimeException("Outbox row " + row.dedupKey() + " holds an unreadable envelope", e);
        }
        try {
            broker.publish(envelope.topic(), envelope);
        } catch (BrokerUnavailableException e) {
            log.warn("Broker unavailable, outbox row {} stays pending: {}", row.dedupKey(), e.getMessage());
            return false;
        }
        scheduleStore.markPublished(row.dedupKey(), nowMs);
        return true;
    }

    private void syncIfChanged() {
        List<ScheduleDefinition> current = definitions.get();
        if (current.equals(synced)) {
            return;
        }
        scheduleStore.syncEntries(current, clock.getAsLong());
        synced = current;
        log.info("Beat tracking {} schedule(s)", current.size());
    }

    private void audit(ScheduleDefinition def, long windowStart, String dedupKey) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of("schedule.fire", "beat", "schedule/" + def.name(), "ok", null, Map.of(
                "task_type", def.taskType(),
                "window_start_ms", windowStart,
                "dedup_key", dedupKey
        )));
    }

    public record TickOutcome(long tickAtMs, int fired, int published) {
    }
}
