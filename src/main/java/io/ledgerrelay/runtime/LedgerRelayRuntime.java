package io.ledgerrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.ledgerrelay.anchor.CheckTrustlinesHandler;
import io.ledgerrelay.anchor.CreateStellarDepositHandler;
import io.ledgerrelay.anchor.ProcessLedgerEventHandler;
import io.ledgerrelay.bus.Broker;
import io.ledgerrelay.bus.BrokerUnavailableException;
import io.ledgerrelay.bus.DeadLetter;
import io.ledgerrelay.bus.FileBroker;
import io.ledgerrelay.config.LedgerRelayConfig;
import io.ledgerrelay.config.RuntimeSettings;
import io.ledgerrelay.ledger.HorizonClient;
import io.ledgerrelay.ledger.InterestPredicate;
import io.ledgerrelay.model.AnchorStatus;
import io.ledgerrelay.model.AnchorTransaction;
import io.ledgerrelay.model.MessageEnvelope;
import io.ledgerrelay.model.TaskView;
import io.ledgerrelay.observability.AuditLogger;
import io.ledgerrelay.storage.AnchorTransactionStore;
import io.ledgerrelay.storage.CheckpointStore;
import io.ledgerrelay.storage.Database;
import io.ledgerrelay.storage.ScheduleStore;
import io.ledgerrelay.storage.TaskStore;
import io.ledgerrelay.task.EchoHandler;
import io.ledgerrelay.task.TaskHandlerRegistry;
import io.ledgerrelay.util.Jsons;
import io.ledgerrelay.util.Sleeper;
import io.ledgerrelay.watcher.LedgerWatcher;
import io.ledgerrelay.watcher.WatcherOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

public final class LedgerRelayRuntime {
    private static final Logger log = LoggerFactory.getLogger(LedgerRelayRuntime.class);

    private final LedgerRelayConfig config;
    private final Database database;
    private final TaskStore taskStore;
    private final CheckpointStore checkpointStore;
    private final ScheduleStore scheduleStore;
    private final AnchorTransactionStore anchorStore;
    private final Broker broker;
    private final AuditLogger auditLogger;
    private volatile long runtimeSettingsFileMtimeMs;
    private volatile long lastRuntimeSettingsCheckMs;
    private volatile RuntimeSettings runtimeSettings;

    public LedgerRelayRuntime(LedgerRelayConfig config) {
        this(config, new FileBroker(config));
    }

    public LedgerRelayRuntime(LedgerRelayConfig config, Broker broker) {
        this.config = config;
        this.database = new Database(config);
        this.taskStore = new TaskStore(database);
        this.checkpointStore = new CheckpointStore(database);
        this.scheduleStore = new ScheduleStore(database);
        this.anchorStore = new AnchorTransactionStore(database);
        this.broker = broker;
        this.auditLogger = new AuditLogger(config.auditFile());
        this.runtimeSettingsFileMtimeMs = Long.MIN_VALUE;
        this.lastRuntimeSettingsCheckMs = 0L;
        this.runtimeSettings = RuntimeSettings.defaults();
    }

    public void init() {
        database.init();
        loadRuntimeSettings(true);
    }

    public LedgerRelayConfig config() {
        return config;
    }

    public RuntimeSettings settings() {
        return runtimeSettings;
    }

    public Broker broker() {
        return broker;
    }

    public TaskStore taskStore() {
        return taskStore;
    }

    public CheckpointStore checkpointStore() {
        return checkpointStore;
    }

    public AnchorTransactionStore anchorStore() {
        return anchorStore;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public SettingsReloadOutcome reloadSettings() {
        return loadRuntimeSettings(true);
    }

    public SettingsReloadOutcome maybeReloadSettings(long minIntervalMs) {
        long nowMs = Instant.now().toEpochMilli();
        long interval = Math.max(1_000L, minIntervalMs);
        if ((nowMs - lastRuntimeSettingsCheckMs) < interval) {
            return new SettingsReloadOutcome(
                    false,
                    runtimeSettingsFileMtimeMs >= 0L,
                    config.settingsFile().toString(),
                    runtimeSettings,
                    "skip_interval",
                    nowMs,
                    List.of()
            );
        }
        lastRuntimeSettingsCheckMs = nowMs;
        return loadRuntimeSettings(false);
    }

    public HorizonClient horizonClient() {
        RuntimeSettings settings = runtimeSettings;
        return new HorizonClient(settings.horizonUrl(), settings.watchedAccount(), Duration.ofMillis(settings.httpTimeoutMs()));
    }

    public TaskHandlerRegistry handlerRegistry() {
        HorizonClient horizon = horizonClient();
        return new TaskHandlerRegistry()
                .register(new EchoHandler())
                .register(new ProcessLedgerEventHandler(anchorStore, System::currentTimeMillis))
                .register(new CheckTrustlinesHandler(anchorStore, horizon, broker, System::currentTimeMillis))
                .register(new CreateStellarDepositHandler(anchorStore, horizon, horizon,
                        () -> runtimeSettings.deposit(), System::currentTimeMillis));
    }

    public LedgerWatcher newWatcher() {
        RuntimeSettings settings = runtimeSettings;
        return new LedgerWatcher(
                horizonClient(),
                broker,
                checkpointStore,
                InterestPredicate.from(settings),
                WatcherOptions.from(settings),
                Sleeper.SYSTEM,
                System::currentTimeMillis,
                auditLogger
        );
    }

    public TaskRunner newTaskRunner(String consumerId) {
        return newTaskRunner(consumerId, handlerRegistry());
    }

    public TaskRunner newTaskRunner(String consumerId, TaskHandlerRegistry registry) {
        return new TaskRunner(
                broker,
                taskStore,
                registry,
                sanitizeConsumerId(consumerId),
                List.of(LedgerRelayConfig.TASKS_TOPIC, LedgerRelayConfig.LEDGER_TOPIC),
                this::settings,
                System::currentTimeMillis,
                auditLogger
        );
    }

    public BeatScheduler newBeatScheduler() {
        return new BeatScheduler(scheduleStore, broker, () -> runtimeSettings.schedules(),
                System::currentTimeMillis, auditLogger);
    }

    public EnqueueOutcome enqueue(String taskType, String payloadJson, String dedupKey) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType must not be blank");
        }
        String raw = payloadJson == null || payloadJson.isBlank() ? "{}" : payloadJson;
        long payloadBytes = raw.getBytes(StandardCharsets.UTF_8).length;
        if (payloadBytes > LedgerRelayConfig.DEFAULT_PAYLOAD_MAX_BYTES) {
            throw new IllegalArgumentException(
                    "Payload too large: " + payloadBytes + " bytes, max=" + LedgerRelayConfig.DEFAULT_PAYLOAD_MAX_BYTES
            );
        }
        JsonNode payload = Jsons.readTree(raw);
        if (!payload.isObject()) {
            throw new IllegalArgumentException("payload must be a JSON object");
        }
        if (dedupKey != null && !dedupKey.isBlank()) {
            Optional<TaskView> existing = taskStore.findByDedupKey(dedupKey.trim());
            if (existing.isPresent()) {
                return new EnqueueOutcome(existing.get().taskId(), null, dedupKey.trim(), true, "Task deduplicated by dedup key");
            }
        }
        MessageEnvelope envelope = MessageEnvelope.task(LedgerRelayConfig.TASKS_TOPIC, taskType.trim(), payload,
                dedupKey == null ? null : dedupKey.trim(), false);
        broker.publish(envelope.topic(), envelope);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "task.enqueue",
                "cli",
                "topic/" + envelope.topic(),
                "published",
                null,
                Map.of("task_type", envelope.taskType(), "dedup_key", envelope.dedupKey(), "msg_id", envelope.msgId())
        ));
        return new EnqueueOutcome(null, envelope.msgId(), envelope.dedupKey(), false, "Task published");
    }

    public Optional<TaskView> getTask(String taskId) {
        return taskStore.getTask(taskId);
    }

    public List<TaskView> tasks(String status, int limit, int offset) {
        return taskStore.listTasks(status, limit, offset);
    }

    public List<DeadLetter> deadLetters(int limit) {
        return broker.deadLetters(limit);
    }

    public ReplayOutcome replay(String taskId) {
        Optional<TaskView> task = taskStore.getTask(taskId);
        if (task.isEmpty()) {
            auditReplay(taskId, "not_found", Map.of());
            return new ReplayOutcome(taskId, false, "Task not found");
        }
        long now = Instant.now().toEpochMilli();
        Optional<TaskStore.ReplayTicket> ticket = taskStore.prepareReplay(taskId, now);
        if (ticket.isEmpty()) {
            auditReplay(taskId, "invalid_state", Map.of("status", task.get().status()));
            return new ReplayOutcome(taskId, false, "Task is not in FAILED state");
        }
        MessageEnvelope envelope;
        try {
            envelope = Jsons.mapper().readValue(ticket.get().envelopeJson(), MessageEnvelope.class).redelivery(1);
        } catch (IOException e) {
            taskStore.revertReplay(taskId, "replay failed: stored envelope unreadable", now);
            throw new RuntimeException("Stored envelope of task " + taskId + " is unreadable", e);
        }
        try {
            broker.publish(envelope.topic(), envelope);
        } catch (BrokerUnavailableException e) {
            taskStore.revertReplay(taskId, "replay failed: " + e.getMessage(), Instant.now().toEpochMilli());
            auditReplay(taskId, "broker_unavailable", Map.of());
            throw e;
        }
        auditReplay(taskId, "replayed", Map.of("msg_id", envelope.msgId()));
        return new ReplayOutcome(taskId, true, "Replayed to queue");
    }

    public CursorView cursor(String watcherId) {
        String id = watcherId == null || watcherId.isBlank() ? runtimeSettings.watcherId() : watcherId.trim();
        return checkpointStore.load(id)
                .map(cp -> new CursorView(id, cp.cursor(), cp.position(), cp.updatedAtMs()))
                .orElse(new CursorView(id, null, -1L, 0L));
    }

    public CursorView resetCursor(String watcherId, String cursor) {
        String id = watcherId == null || watcherId.isBlank() ? runtimeSettings.watcherId() : watcherId.trim();
        CursorView before = cursor(id);
        checkpointStore.reset(id, cursor, Instant.now().toEpochMilli());
        CursorView after = cursor(id);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "ledger.cursor.reset",
                "cli",
                "cursor/" + id,
                "ok",
                null,
                Map.of("before", String.valueOf(before.cursor()), "after", String.valueOf(after.cursor()))
        ));
        log.warn("Checkpoint of watcher {} reset from {} to {}", id, before.cursor(), after.cursor());
        return after;
    }

    public List<ScheduleStore.ScheduleEntry> schedules() {
        return scheduleStore.listEntries();
    }

    public AnchorTransaction addAnchorTransaction(String kind, String statusRaw, String assetCode, String account,
                                                  String amountIn, String amountFee, String memo, String memoType) {
        String normalizedKind = kind == null ? "" : kind.trim().toLowerCase(Locale.ROOT);
        if (!AnchorTransaction.KIND_DEPOSIT.equals(normalizedKind) && !AnchorTransaction.KIND_WITHDRAWAL.equals(normalizedKind)) {
            throw new IllegalArgumentException("kind must be deposit or withdrawal: " + kind);
        }
        if (assetCode == null || assetCode.isBlank()) {
            throw new IllegalArgumentException("assetCode must not be blank");
        }
        AnchorStatus status;
        if (statusRaw == null || statusRaw.isBlank()) {
            status = AnchorTransaction.KIND_DEPOSIT.equals(normalizedKind)
                    ? AnchorStatus.PENDING_TRUST
                    : AnchorStatus.PENDING_USER_TRANSFER_START;
        } else {
            status = AnchorStatus.fromString(statusRaw);
        }
        long now = Instant.now().toEpochMilli();
        AnchorTransaction tx = new AnchorTransaction(
                "atx_" + UUID.randomUUID(),
                normalizedKind,
                status.wireName(),
                assetCode.trim(),
                blankToNull(account),
                blankToNull(amountIn),
                blankToNull(amountFee),
                null,
                blankToNull(memo),
                blankToNull(memoType),
                null,
                now,
                null,
                now
        );
        anchorStore.insert(tx);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "anchor.add",
                "cli",
                "anchor/" + tx.id(),
                "ok",
                null,
                Map.of("kind", tx.kind(), "status", tx.status(), "asset_code", tx.assetCode())
        ));
        return tx;
    }

    public List<AnchorTransaction> anchorTransactions(String kind, String status, int limit) {
        return anchorStore.list(kind, status, limit);
    }

    public StatsOutcome stats() {
        Map<String, Integer> depths = new LinkedHashMap<>();
        depths.put(LedgerRelayConfig.TASKS_TOPIC, broker.depth(LedgerRelayConfig.TASKS_TOPIC));
        depths.put(LedgerRelayConfig.LEDGER_TOPIC, broker.depth(LedgerRelayConfig.LEDGER_TOPIC));
        int pendingOutbox = 0;
        for (ScheduleStore.ScheduleEntry entry : scheduleStore.listEntries()) {
            pendingOutbox += entry.pendingOutbox();
        }
        return new StatsOutcome(
                taskStore.countByStatus(),
                depths,
                countMessageFiles(config.processingDir()),
                countMessageFiles(config.retryRoot()),
                countMessageFiles(config.deadRoot()),
                cursor(null),
                pendingOutbox,
                Instant.now().toEpochMilli()
        );
    }

    public AuditVerifyOutcome verifyAudit() {
        try {
            int rows = auditLogger.verifyChain();
            return new AuditVerifyOutcome(true, rows, "");
        } catch (IllegalStateException e) {
            return new AuditVerifyOutcome(false, -1, e.getMessage());
        }
    }

    public List<Database.SchemaMigrationRow> schemaMigrations() {
        return database.listSchemaMigrations();
    }

    private SettingsReloadOutcome loadRuntimeSettings(boolean force) {
        RuntimeSettings defaults = RuntimeSettings.defaults();
        Path cfg = config.settingsFile();
        long checkedAtMs = Instant.now().toEpochMilli();
        long mtime = resolveFileMtimeMs(cfg);
        if (!force && mtime == runtimeSettingsFileMtimeMs) {
            return new SettingsReloadOutcome(false, mtime >= 0L, cfg.toString(), runtimeSettings, "unchanged", checkedAtMs, List.of());
        }
        if (mtime < 0L) {
            RuntimeSettings current = runtimeSettings;
            runtimeSettings = defaults;
            runtimeSettingsFileMtimeMs = -1L;
            boolean changed = !defaults.equals(current);
            List<String> changedFields = changed ? current.diff(defaults) : List.of();
            if (changed) {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "runtime.settings.load",
                        "system",
                        "runtime/settings",
                        "ok_default",
                        null,
                        Map.of(
                                "config", cfg.toString(),
                                "source", "defaults",
                                "changed", true,
                                "changed_fields", changedFields
                        )
                ));
            }
            return new SettingsReloadOutcome(changed, false, cfg.toString(), defaults, "defaults", checkedAtMs, changedFields);
        }
        RuntimeSettings resolved = RuntimeSettings.load(cfg);
        RuntimeSettings previous = runtimeSettings;
        runtimeSettings = resolved;
        runtimeSettingsFileMtimeMs = mtime;
        boolean changed = !resolved.equals(previous);
        List<String> changedFields = changed ? previous.diff(resolved) : List.of();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "runtime.settings.load",
                "system",
                "runtime/settings",
                changed ? "reloaded" : "ok",
                null,
                Map.of(
                        "config", cfg.toString(),
                        "changed", changed,
                        "changed_fields", changedFields,
                        "config_mtime_ms", mtime
                )
        ));
        if (changed) {
            log.info("Runtime settings loaded from {}, changed: {}", cfg, changedFields);
        }
        return new SettingsReloadOutcome(changed, true, cfg.toString(), resolved,
                changed ? "reloaded" : "unchanged_content", checkedAtMs, changedFields);
    }

    private long resolveFileMtimeMs(Path path) {
        if (!Files.exists(path)) {
            return -1L;
        }
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings mtime: " + path, e);
        }
    }

    private void auditReplay(String taskId, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of("task.replay", "cli", "task/" + taskId, result, taskId, details));
    }

    private static int countMessageFiles(Path root) {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        try (Stream<Path> stream = Files.walk(root)) {
            return (int) stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".msg.json"))
                    .count();
        } catch (IOException e) {
            throw new RuntimeException("Failed to count files in " + root, e);
        }
    }

    private static String sanitizeConsumerId(String raw) {
        if (raw == null || raw.isBlank()) {
            return "worker-1";
        }
        String id = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "-");
        return id.isBlank() ? "worker-1" : id;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean configExists,
            String sourcePath,
            RuntimeSettings settings,
            String message,
            long checkedAtMs,
            List<String> changedFields
    ) {
    }

    public record EnqueueOutcome(String taskId, String msgId, String dedupKey, boolean deduplicated, String message) {
    }

    public record ReplayOutcome(String taskId, boolean replayed, String message) {
    }

    public record CursorView(String watcherId, String cursor, long position, long updatedAtMs) {
    }

    public record StatsOutcome(
            Map<String, Integer> tasksByStatus,
            Map<String, Integer> topicDepth,
            int processing,
            int retryParked,
            int deadLetters,
            CursorView checkpoint,
            int pendingOutbox,
            long generatedAtMs
    ) {
    }

    public record AuditVerifyOutcome(boolean ok, int rows, String reason) {
    }
}
