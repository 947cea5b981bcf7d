package io.ledgerrelay.runtime;

import io.ledgerrelay.bus.BrokerUnavailableException;
import io.ledgerrelay.bus.FileBroker;
import io.ledgerrelay.bus.FlakyBroker;
import io.ledgerrelay.config.LedgerRelayConfig;
import io.ledgerrelay.model.AnchorTransaction;
import io.ledgerrelay.model.TaskView;
import io.ledgerrelay.task.EchoHandler;
import io.ledgerrelay.task.TaskContext;
import io.ledgerrelay.task.TaskHandler;
import io.ledgerrelay.task.TaskHandlerRegistry;
import io.ledgerrelay.task.TaskResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

final class LedgerRelayRuntimeTest {

    @Test
    void enqueueValidatesPayloadAndDeduplicatesRecordedTasks() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runtime-enqueue-");
        try {
            LedgerRelayRuntime runtime = runtime(root);
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.enqueue(" ", "{}", null));
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.enqueue("echo", "[1,2]", null));
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.enqueue("echo", "{oops", null));
            String huge = "{\"blob\":\"" + "x".repeat((int) LedgerRelayConfig.DEFAULT_PAYLOAD_MAX_BYTES) + "\"}";
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.enqueue("echo", huge, null));

            LedgerRelayRuntime.EnqueueOutcome first = runtime.enqueue("echo", "{\"a\":1}", " order-1 ");
            Assertions.assertFalse(first.deduplicated());
            Assertions.assertNotNull(first.msgId());
            Assertions.assertEquals("order-1", first.dedupKey());

            try (TaskRunner runner = runtime.newTaskRunner("w1", new TaskHandlerRegistry().register(new EchoHandler()))) {
                runner.dispatchOnce();
                Assertions.assertTrue(runner.awaitIdle(5_000L));
            }
            TaskView recorded = runtime.taskStore().findByDedupKey("order-1").orElseThrow();

            LedgerRelayRuntime.EnqueueOutcome again = runtime.enqueue("echo", "{\"a\":2}", "order-1");
            Assertions.assertTrue(again.deduplicated());
            Assertions.assertEquals(recorded.taskId(), again.taskId());
            Assertions.assertNull(again.msgId());
            Assertions.assertEquals(0, runtime.stats().topicDepth().get(LedgerRelayConfig.TASKS_TOPIC));

            LedgerRelayRuntime.EnqueueOutcome anonymous = runtime.enqueue("echo", null, null);
            Assertions.assertEquals(anonymous.msgId(), anonymous.dedupKey());
            Assertions.assertTrue(audit(runtime).contains("task.enqueue"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void replayRequeuesOnlyFailedTasks() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runtime-replay-");
        try {
            LedgerRelayRuntime runtime = runtime(root);
            Files.writeString(runtime.config().settingsFile(), "{\"maxAttempts\":1,\"schedules\":[]}", StandardCharsets.UTF_8);
            runtime.reloadSettings();

            AtomicBoolean healthy = new AtomicBoolean(false);
            TaskHandlerRegistry registry = new TaskHandlerRegistry()
                    .register(new EchoHandler())
                    .register(new TaskHandler() {
                        @Override
                        public String taskType() {
                            return "settle";
                        }

                        @Override
                        public TaskResult execute(TaskContext context) {
                            return healthy.get() ? TaskResult.ok(null) : TaskResult.fail("downstream down");
                        }
                    });
            runtime.enqueue("settle", "{}", "settle-1");
            runtime.enqueue("echo", "{}", "echo-1");
            try (TaskRunner runner = runtime.newTaskRunner("w1", registry)) {
                runner.dispatchOnce();
                Assertions.assertTrue(runner.awaitIdle(5_000L));
                TaskView failed = runtime.taskStore().findByDedupKey("settle-1").orElseThrow();
                TaskView succeeded = runtime.taskStore().findByDedupKey("echo-1").orElseThrow();
                Assertions.assertEquals("FAILED", failed.status());

                LedgerRelayRuntime.ReplayOutcome missing = runtime.replay("task_missing");
                Assertions.assertFalse(missing.replayed());
                Assertions.assertEquals("Task not found", missing.message());
                LedgerRelayRuntime.ReplayOutcome wrongState = runtime.replay(succeeded.taskId());
                Assertions.assertFalse(wrongState.replayed());
                Assertions.assertEquals("Task is not in FAILED state", wrongState.message());

                LedgerRelayRuntime.ReplayOutcome replayed = runtime.replay(failed.taskId());
                Assertions.assertTrue(replayed.replayed());
                Assertions.assertEquals("QUEUED", runtime.getTask(failed.taskId()).orElseThrow().status());

                healthy.set(true);
                runner.dispatchOnce();
                Assertions.assertTrue(runner.awaitIdle(5_000L));
                Assertions.assertEquals("SUCCEEDED", runtime.getTask(failed.taskId()).orElseThrow().status());
            }
            Assertions.assertTrue(audit(runtime).contains("task.replay"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void replayIsRevertedWhenBrokerIsDown() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runtime-replay-down-");
        try {
            LedgerRelayConfig config = LedgerRelayConfig.fromRoot(root.toString());
            FlakyBroker broker = new FlakyBroker(new FileBroker(config));
            LedgerRelayRuntime runtime = new LedgerRelayRuntime(config, broker);
            runtime.init();
            Files.writeString(config.settingsFile(), "{\"maxAttempts\":1,\"schedules\":[]}", StandardCharsets.UTF_8);
            runtime.reloadSettings();

            runtime.enqueue("nobody_handles_this", "{}", "orphan-1");
            try (TaskRunner runner = runtime.newTaskRunner("w1", new TaskHandlerRegistry())) {
                runner.dispatchOnce();
                Assertions.assertTrue(runner.awaitIdle(5_000L));
            }
            TaskView failed = runtime.taskStore().findByDedupKey("orphan-1").orElseThrow();
            Assertions.assertEquals("FAILED", failed.status());

            broker.setAvailable(false);
            Assertions.assertThrows(BrokerUnavailableException.class, () -> runtime.replay(failed.taskId()));
            TaskView after = runtime.getTask(failed.taskId()).orElseThrow();
            Assertions.assertEquals("FAILED", after.status());
            Assertions.assertTrue(after.lastError().contains("replay failed"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsReloadReportsChangedFieldsAndAudits() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runtime-settings-");
        try {
            LedgerRelayRuntime runtime = runtime(root);
            Assertions.assertEquals(3, runtime.settings().maxAttempts());

            Path file = runtime.config().settingsFile();
            Files.writeString(file, "{\"maxAttempts\":5,\"watcherId\":\"primary\"}", StandardCharsets.UTF_8);
            LedgerRelayRuntime.SettingsReloadOutcome reloaded = runtime.reloadSettings();
            Assertions.assertTrue(reloaded.changed());
            Assertions.assertTrue(reloaded.configExists());
            Assertions.assertEquals(List.of("watcherId", "maxAttempts"), reloaded.changedFields());
            Assertions.assertEquals(5, runtime.settings().maxAttempts());

            LedgerRelayRuntime.SettingsReloadOutcome unchanged = runtime.maybeReloadSettings(1_000L);
            Assertions.assertFalse(unchanged.changed());
            Assertions.assertEquals("skip_interval", runtime.maybeReloadSettings(1_000L).message());

            Files.writeString(file, "{\"maxAttempts\":7}", StandardCharsets.UTF_8);
            Files.setLastModifiedTime(file, FileTime.fromMillis(Files.getLastModifiedTime(file).toMillis() + 5_000L));
            Assertions.assertEquals(7, runtime.reloadSettings().settings().maxAttempts());

            Files.delete(file);
            LedgerRelayRuntime.SettingsReloadOutcome defaults = runtime.reloadSettings();
            Assertions.assertFalse(defaults.configExists());
            Assertions.assertEquals(3, runtime.settings().maxAttempts());

            String audit = audit(runtime);
            Assertions.assertTrue(audit.contains("runtime.settings.load"));
            Assertions.assertTrue(audit.contains("ok_default"));
            Assertions.assertTrue(runtime.verifyAudit().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cursorResetIsAuditedAndBlankClears() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runtime-cursor-");
        try {
            LedgerRelayRuntime runtime = runtime(root);
            LedgerRelayRuntime.CursorView empty = runtime.cursor(null);
            Assertions.assertEquals("default", empty.watcherId());
            Assertions.assertNull(empty.cursor());
            Assertions.assertEquals(-1L, empty.position());

            runtime.checkpointStore().advance("default", "900", 1L);
            LedgerRelayRuntime.CursorView reset = runtime.resetCursor(null, "500");
            Assertions.assertEquals("500", reset.cursor());
            Assertions.assertEquals(500L, runtime.stats().checkpoint().position());

            Assertions.assertNull(runtime.resetCursor("default", "").cursor());
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.resetCursor(null, "latest"));
            Assertions.assertTrue(audit(runtime).contains("ledger.cursor.reset"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void anchorTransactionsGetKindSpecificDefaults() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runtime-anchor-");
        try {
            LedgerRelayRuntime runtime = runtime(root);
            AnchorTransaction deposit = runtime.addAnchorTransaction("Deposit", null, "USDC", "GUSER", "100", "1", null, null);
            AnchorTransaction withdrawal = runtime.addAnchorTransaction("withdrawal", "", "USDC", null, "50", null, "w-1", "text");
            Assertions.assertTrue(deposit.id().startsWith("atx_"));
            Assertions.assertEquals("pending_trust", deposit.status());
            Assertions.assertEquals("pending_user_transfer_start", withdrawal.status());
            Assertions.assertNull(withdrawal.stellarAccount());

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.addAnchorTransaction("refund", null, "USDC", null, null, null, null, null));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.addAnchorTransaction("deposit", "settled", "USDC", null, null, null, null, null));

            Assertions.assertEquals(2, runtime.anchorTransactions(null, null, 10).size());
            List<AnchorTransaction> waiting = runtime.anchorTransactions("deposit", "PENDING_TRUST", 10);
            Assertions.assertEquals(1, waiting.size());
            Assertions.assertEquals(deposit.id(), waiting.get(0).id());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void statsAndMaintenanceViews() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runtime-stats-");
        try {
            LedgerRelayRuntime runtime = runtime(root);
            runtime.enqueue("echo", "{}", "s-1");
            runtime.enqueue("echo", "{}", "s-2");

            LedgerRelayRuntime.StatsOutcome stats = runtime.stats();
            Assertions.assertEquals(2, stats.topicDepth().get(LedgerRelayConfig.TASKS_TOPIC));
            Assertions.assertEquals(0, stats.topicDepth().get(LedgerRelayConfig.LEDGER_TOPIC));
            Assertions.assertEquals(0, stats.tasksByStatus().get("QUEUED"));
            Assertions.assertEquals(0, stats.deadLetters());
            Assertions.assertEquals(0, stats.pendingOutbox());

            Assertions.assertFalse(runtime.schemaMigrations().isEmpty());
            Assertions.assertTrue(runtime.schemaMigrations().stream().allMatch(m -> m.success()));
            Assertions.assertEquals(List.of("check_trustlines", "create_stellar_deposit", "echo", "process_ledger_event"),
                    List.copyOf(runtime.handlerRegistry().listTaskTypes()));

            runtime.newBeatScheduler().tick(60_000L);
            Assertions.assertEquals(1, runtime.schedules().size());
            Assertions.assertEquals(3, runtime.stats().topicDepth().get(LedgerRelayConfig.TASKS_TOPIC));

            LedgerRelayRuntime.AuditVerifyOutcome verify = runtime.verifyAudit();
            Assertions.assertTrue(verify.ok());
            Assertions.assertTrue(verify.rows() >= 3);
        } finally {
            deleteRecursively(root);
        }
    }

    private static LedgerRelayRuntime runtime(Path root) {
        LedgerRelayRuntime runtime = new LedgerRelayRuntime(LedgerRelayConfig.fromRoot(root.toString()));
        runtime.init();
        return runtime;
    }

    private static String audit(LedgerRelayRuntime runtime) throws IOException {
        return Files.readString(runtime.config().auditFile(), StandardCharsets.UTF_8);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
