package io.ledgerrelay.cli;

import io.ledgerrelay.config.LedgerRelayConfig;
import io.ledgerrelay.model.AnchorTransaction;
import io.ledgerrelay.model.TaskView;
import io.ledgerrelay.runtime.BeatScheduler;
import io.ledgerrelay.runtime.LedgerRelayRuntime;
import io.ledgerrelay.runtime.TaskRunner;
import io.ledgerrelay.util.Jsons;
import io.ledgerrelay.watcher.LedgerWatcher;
import io.ledgerrelay.watcher.WatchOutcome;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "ledgerrelay",
        mixinStandardHelpOptions = true,
        description = "Stellar ledger watcher, task worker and beat scheduler",
        subcommands = {
                LedgerRelayCommand.InitCommand.class,
                LedgerRelayCommand.WatchCommand.class,
                LedgerRelayCommand.WorkerCommand.class,
                LedgerRelayCommand.BeatCommand.class,
                LedgerRelayCommand.RunCommand.class,
                LedgerRelayCommand.EnqueueCommand.class,
                LedgerRelayCommand.TaskCommand.class,
                LedgerRelayCommand.TasksCommand.class,
                LedgerRelayCommand.DeadLettersCommand.class,
                LedgerRelayCommand.ReplayCommand.class,
                LedgerRelayCommand.CursorCommand.class,
                LedgerRelayCommand.SchedulesCommand.class,
                LedgerRelayCommand.AnchorCommand.class,
                LedgerRelayCommand.StatsCommand.class,
                LedgerRelayCommand.ReloadSettingsCommand.class,
                LedgerRelayCommand.AuditVerifyCommand.class,
                LedgerRelayCommand.SchemaMigrationsCommand.class
        }
)
public final class LedgerRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | watch | worker | beat | run | enqueue | task | tasks | dead-letters | replay | cursor show|reset | schedules | anchor add|list | stats | reload-settings | audit-verify | schema-migrations");
    }

    LedgerRelayRuntime runtime() {
        return new LedgerRelayRuntime(LedgerRelayConfig.fromRoot(root));
    }

    static void installShutdownHook(AtomicBoolean running, Runnable onStop, long graceMs) {
        Thread main = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            running.set(false);
            onStop.run();
            try {
                main.join(graceMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "ledgerrelay-shutdown-hook"));
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println("Initialized LedgerRelay at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "watch", description = "Follow the ledger and publish transactions of interest")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Poll a single page and exit")
        boolean once;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            LedgerWatcher watcher = runtime.newWatcher();
            if (once) {
                WatchOutcome outcome = watcher.pollOnce();
                System.out.println(Jsons.toJson(outcome));
                return outcome.bufferSize() == 0 ? 0 : 1;
            }
            AtomicBoolean running = new AtomicBoolean(true);
            installShutdownHook(running, watcher::stop, 10_000L);
            watcher.run();
            return 0;
        }
    }

    @Command(name = "worker", description = "Run the task worker pool")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run one dispatch round, wait for it and exit")
        boolean once;

        @Option(names = {"--worker-id"}, defaultValue = "worker-1", description = "Consumer identity")
        String workerId;

        @Option(names = {"--settings-reload-ms"}, defaultValue = "10000",
                description = "Check interval for hot-reloading ledgerrelay-settings.json")
        long settingsReloadMs;

        @Override
        public Integer call() throws Exception {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            try (TaskRunner runner = runtime.newTaskRunner(workerId)) {
                if (once) {
                    runner.recover();
                    runner.dispatchOnce();
                    boolean idle = runner.awaitIdle(runtime.settings().taskTimeoutMs());
                    runner.dispatchOnce();
                    System.out.println(Jsons.toJson(runner.stats()));
                    return idle ? 0 : 1;
                }
                AtomicBoolean running = new AtomicBoolean(true);
                installShutdownHook(running, () -> { }, 15_000L);
                runner.start();
                superviseLoop(runtime, running, settingsReloadMs, null);
            }
            return 0;
        }
    }

    @Command(name = "beat", description = "Fire recurring tasks once per interval")
    static final class BeatCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run a single tick and exit")
        boolean once;

        @Option(names = {"--settings-reload-ms"}, defaultValue = "10000",
                description = "Check interval for hot-reloading ledgerrelay-settings.json")
        long settingsReloadMs;

        @Override
        public Integer call() throws Exception {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            BeatScheduler beat = runtime.newBeatScheduler();
            if (once) {
                System.out.println(Jsons.toJson(beat.tick()));
                return 0;
            }
            AtomicBoolean running = new AtomicBoolean(true);
            installShutdownHook(running, () -> { }, 5_000L);
            beat.start();
            superviseLoop(runtime, running, settingsReloadMs, beat);
            return 0;
        }
    }

    @Command(name = "run", description = "Run worker pool and beat in one process")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Option(names = {"--worker-id"}, defaultValue = "worker-1", description = "Consumer identity")
        String workerId;

        @Option(names = {"--settings-reload-ms"}, defaultValue = "10000",
                description = "Check interval for hot-reloading ledgerrelay-settings.json")
        long settingsReloadMs;

        @Override
        public Integer call() throws Exception {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            BeatScheduler beat = runtime.newBeatScheduler();
            try (TaskRunner runner = runtime.newTaskRunner(workerId)) {
                AtomicBoolean running = new AtomicBoolean(true);
                installShutdownHook(running, () -> { }, 15_000L);
                runner.start();
                beat.start();
                superviseLoop(runtime, running, settingsReloadMs, beat);
            }
            return 0;
        }
    }

    static void superviseLoop(LedgerRelayRuntime runtime, AtomicBoolean running, long settingsReloadMs,
                              BeatScheduler beat) throws InterruptedException {
        while (running.get()) {
            LedgerRelayRuntime.SettingsReloadOutcome reload = runtime.maybeReloadSettings(settingsReloadMs);
            if (reload.changed()) {
                System.out.println(Jsons.toJson(reload));
            }
            if (beat != null) {
                beat.tick();
            }
            Thread.sleep(runtime.settings().beatTickMs());
        }
    }

    @Command(name = "enqueue", description = "Publish an ad-hoc task")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Option(names = {"--type"}, required = true, description = "Task type")
        String taskType;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "JSON object payload")
        String payload;

        @Option(names = {"--dedup-key"}, description = "Optional dedup key")
        String dedupKey;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            LedgerRelayRuntime.EnqueueOutcome outcome = runtime.enqueue(taskType, payload, dedupKey);
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "task", description = "Query task status by task id")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            Optional<TaskView> task = runtime.getTask(taskId);
            if (task.isEmpty()) {
                System.out.println("{\"error\":\"task not found\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(task.get()));
            return 0;
        }
    }

    @Command(name = "tasks", description = "List tasks")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Option(names = {"--status"}, description = "Filter by status")
        String status;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Offset")
        int offset;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            List<TaskView> tasks = runtime.tasks(status, limit, offset);
            System.out.println(Jsons.toJson(tasks));
            return 0;
        }
    }

    @Command(name = "dead-letters", description = "Show the most recent dead-lettered messages")
    static final class DeadLettersCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.deadLetters(limit)));
            return 0;
        }
    }

    @Command(name = "replay", description = "Re-queue a FAILED task")
    static final class ReplayCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            LedgerRelayRuntime.ReplayOutcome out = runtime.replay(taskId);
            System.out.println(Jsons.toJson(out));
            return out.replayed() ? 0 : 1;
        }
    }

    @Command(
            name = "cursor",
            description = "Inspect or reset the watcher checkpoint",
            subcommands = {CursorShowCommand.class, CursorResetCommand.class}
    )
    static final class CursorCommand implements Runnable {
        @ParentCommand
        LedgerRelayCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: show | reset");
        }
    }

    @Command(name = "show", description = "Show the persisted checkpoint")
    static final class CursorShowCommand implements Callable<Integer> {
        @ParentCommand
        CursorCommand cursor;

        @Option(names = {"--watcher-id"}, description = "Watcher id; defaults to the configured one")
        String watcherId;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = cursor.parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.cursor(watcherId)));
            return 0;
        }
    }

    @Command(name = "reset", description = "Overwrite the checkpoint (operator only)")
    static final class CursorResetCommand implements Callable<Integer> {
        @ParentCommand
        CursorCommand cursor;

        @Option(names = {"--watcher-id"}, description = "Watcher id; defaults to the configured one")
        String watcherId;

        @Option(names = {"--to"}, defaultValue = "", description = "New paging token; empty restarts from the oldest record")
        String to;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = cursor.parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.resetCursor(watcherId, to)));
            return 0;
        }
    }

    @Command(name = "schedules", description = "List recurring tasks and their last fire")
    static final class SchedulesCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.schedules()));
            return 0;
        }
    }

    @Command(
            name = "anchor",
            description = "Manage anchor deposits and withdrawals",
            subcommands = {AnchorAddCommand.class, AnchorListCommand.class}
    )
    static final class AnchorCommand implements Runnable {
        @ParentCommand
        LedgerRelayCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: add | list");
        }
    }

    @Command(name = "add", description = "Record a deposit or withdrawal")
    static final class AnchorAddCommand implements Callable<Integer> {
        @ParentCommand
        AnchorCommand anchor;

        @Option(names = {"--kind"}, required = true, description = "deposit|withdrawal")
        String kind;

        @Option(names = {"--asset"}, required = true, description = "Asset code")
        String asset;

        @Option(names = {"--status"}, description = "Initial status; defaults by kind")
        String status;

        @Option(names = {"--account"}, description = "Stellar account of the user")
        String account;

        @Option(names = {"--amount"}, description = "Amount in")
        String amountIn;

        @Option(names = {"--fee"}, description = "Amount fee")
        String amountFee;

        @Option(names = {"--memo"}, description = "Memo the user attaches to the payment")
        String memo;

        @Option(names = {"--memo-type"}, description = "text|id|hash")
        String memoType;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = anchor.parent.runtime();
            runtime.init();
            AnchorTransaction tx = runtime.addAnchorTransaction(kind, status, asset, account, amountIn, amountFee, memo, memoType);
            System.out.println(Jsons.toJson(tx));
            return 0;
        }
    }

    @Command(name = "list", description = "List anchor transactions")
    static final class AnchorListCommand implements Callable<Integer> {
        @ParentCommand
        AnchorCommand anchor;

        @Option(names = {"--kind"}, description = "deposit|withdrawal")
        String kind;

        @Option(names = {"--status"}, description = "Filter by status")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = anchor.parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.anchorTransactions(kind, status, limit)));
            return 0;
        }
    }

    @Command(name = "stats", description = "Show task, queue and checkpoint counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.stats()));
            return 0;
        }
    }

    @Command(name = "reload-settings", description = "Reload ledgerrelay-settings.json")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            LedgerRelayRuntime.SettingsReloadOutcome out = runtime.reloadSettings();
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            LedgerRelayRuntime.AuditVerifyOutcome out = runtime.verifyAudit();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        LedgerRelayCommand parent;

        @Override
        public Integer call() {
            LedgerRelayRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.schemaMigrations()));
            return 0;
        }
    }
}
