package io.ledgerrelay.runtime;

import io.ledgerrelay.config.LedgerRelayConfig;
import io.ledgerrelay.model.MessageEnvelope;
import io.ledgerrelay.model.TaskView;
import io.ledgerrelay.task.EchoHandler;
import io.ledgerrelay.task.TaskContext;
import io.ledgerrelay.task.TaskExecutionException;
import io.ledgerrelay.task.TaskHandler;
import io.ledgerrelay.task.TaskHandlerRegistry;
import io.ledgerrelay.task.TaskResult;
import io.ledgerrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class TaskRunnerTest {
    private static final String FAST_RETRY_SETTINGS = """
            {"workerPoolSize":2,"maxAttempts":3,"baseBackoffMs":1,"maxBackoffMs":1,
             "taskTimeoutMs":30000,"dispatchIntervalMs":10,"schedules":[]}
            """;

    @Test
    void successfulTaskIsRecordedAndAcked() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runner-ok-");
        try {
            LedgerRelayRuntime runtime = runtime(root, FAST_RETRY_SETTINGS);
            runtime.enqueue("echo", "{\"n\":1}", "echo-1");
            try (TaskRunner runner = runtime.newTaskRunner("Worker 1", new TaskHandlerRegistry().register(new EchoHandler()))) {
                TaskView done = drainUntilTerminal(runner, runtime, "echo-1");
                Assertions.assertEquals("SUCCEEDED", done.status());
                Assertions.assertEquals(1, done.attempt());
                Assertions.assertEquals(1, Jsons.readTree(done.result()).path("received").path("n").asInt());
                Assertions.assertEquals("worker-1", runner.stats().consumerId());
                Assertions.assertEquals(1L, runner.stats().succeeded());
            }
            Assertions.assertEquals(0, runtime.stats().processing());
            Assertions.assertEquals(0, runtime.stats().topicDepth().get(LedgerRelayConfig.TASKS_TOPIC));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failingHandlerDoesNotAffectOtherTasks() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runner-isolation-");
        try {
            LedgerRelayRuntime runtime = runtime(root, """
                    {"workerPoolSize":2,"maxAttempts":1,"baseBackoffMs":1,"maxBackoffMs":1,"schedules":[]}
                    """);
            TaskHandlerRegistry registry = new TaskHandlerRegistry()
                    .register(new EchoHandler())
                    .register(handler("boom", ctx -> {
                        throw new IllegalStateException("kaput");
                    }));
            runtime.enqueue("boom", "{}", "boom-1");
            runtime.enqueue("echo", "{}", "echo-1");
            try (TaskRunner runner = runtime.newTaskRunner("w1", registry)) {
                TaskView boom = drainUntilTerminal(runner, runtime, "boom-1");
                TaskView echo = drainUntilTerminal(runner, runtime, "echo-1");
                Assertions.assertEquals("FAILED", boom.status());
                Assertions.assertEquals("IllegalStateException: kaput", boom.lastError());
                Assertions.assertEquals("SUCCEEDED", echo.status());
            }
            Assertions.assertEquals(1, runtime.deadLetters(10).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void retryableFailureIsRetriedUntilItSucceeds() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runner-retry-");
        try {
            LedgerRelayRuntime runtime = runtime(root, FAST_RETRY_SETTINGS);
            AtomicInteger calls = new AtomicInteger();
            TaskHandlerRegistry registry = new TaskHandlerRegistry().register(handler("flaky", ctx -> {
                if (calls.incrementAndGet() < 3) {
                    return TaskResult.fail("not yet");
                }
                return TaskResult.ok(Jsons.mapper().createObjectNode().put("attempt", ctx.attempt()));
            }));
            runtime.enqueue("flaky", "{}", "flaky-1");
            try (TaskRunner runner = runtime.newTaskRunner("w1", registry)) {
                TaskView done = drainUntilTerminal(runner, runtime, "flaky-1");
                Assertions.assertEquals("SUCCEEDED", done.status());
                Assertions.assertEquals(3, done.attempt());
                Assertions.assertEquals(3, calls.get());
                Assertions.assertEquals(2L, runner.stats().retried());
            }
            Assertions.assertTrue(runtime.deadLetters(10).isEmpty());
            Assertions.assertEquals(0, runtime.stats().retryParked());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exhaustedRetriesEndInDeadLetter() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runner-dead-");
        try {
            LedgerRelayRuntime runtime = runtime(root, FAST_RETRY_SETTINGS);
            AtomicInteger calls = new AtomicInteger();
            TaskHandlerRegistry registry = new TaskHandlerRegistry().register(handler("always_fails", ctx -> {
                calls.incrementAndGet();
                throw new TaskExecutionException("downstream refused");
            }));
            runtime.enqueue("always_fails", "{\"id\":7}", "fail-1");
            try (TaskRunner runner = runtime.newTaskRunner("w1", registry)) {
                TaskView failed = drainUntilTerminal(runner, runtime, "fail-1");
                Assertions.assertEquals("FAILED", failed.status());
                Assertions.assertEquals(3, failed.attempt());
                Assertions.assertEquals("downstream refused", failed.lastError());
                Assertions.assertEquals(1L, runner.stats().deadLettered());
            }
            Assertions.assertEquals(3, calls.get());
            Assertions.assertEquals(1, runtime.deadLetters(10).size());
            Assertions.assertEquals("fail-1", runtime.deadLetters(10).get(0).message().path("dedupKey").asText());
            String audit = Files.readString(runtime.config().auditFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(audit.contains("task.dead_letter"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nonRetryableFailureSkipsRemainingAttempts() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runner-fatal-");
        try {
            LedgerRelayRuntime runtime = runtime(root, FAST_RETRY_SETTINGS);
            AtomicInteger calls = new AtomicInteger();
            TaskHandlerRegistry registry = new TaskHandlerRegistry().register(handler("strict", ctx -> {
                calls.incrementAndGet();
                return TaskResult.fatal("payload rejected");
            }));
            runtime.enqueue("strict", "{}", "strict-1");
            runtime.enqueue("unknown_type", "{}", "unknown-1");
            try (TaskRunner runner = runtime.newTaskRunner("w1", registry)) {
                TaskView strict = drainUntilTerminal(runner, runtime, "strict-1");
                Assertions.assertEquals("FAILED", strict.status());
                Assertions.assertEquals(1, strict.attempt());

                TaskView unknown = drainUntilTerminal(runner, runtime, "unknown-1");
                Assertions.assertEquals("FAILED", unknown.status());
                Assertions.assertEquals(1, unknown.attempt());
                Assertions.assertEquals("no handler registered for task type unknown_type", unknown.lastError());
            }
            Assertions.assertEquals(1, calls.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void slowTaskTimesOutAndLateResultIsDiscarded() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runner-timeout-");
        try {
            LedgerRelayRuntime runtime = runtime(root, """
                    {"workerPoolSize":1,"maxAttempts":3,"taskTimeoutMs":100,"schedules":[]}
                    """);
            AtomicInteger interrupted = new AtomicInteger();
            TaskHandlerRegistry registry = new TaskHandlerRegistry().register(handler("slow", ctx -> {
                try {
                    Thread.sleep(30_000L);
                } catch (InterruptedException e) {
                    interrupted.incrementAndGet();
                    throw e;
                }
                return TaskResult.ok(null);
            }));
            runtime.enqueue("slow", "{}", "slow-1");
            try (TaskRunner runner = runtime.newTaskRunner("w1", registry)) {
                Assertions.assertEquals(1, runner.dispatchOnce());
                Assertions.assertEquals(0, runner.stats().freeSlots());
                Thread.sleep(250L);
                runner.dispatchOnce();
                Assertions.assertTrue(runner.awaitIdle(5_000L));

                TaskView failed = runtime.taskStore().findByDedupKey("slow-1").orElseThrow();
                Assertions.assertEquals("FAILED", failed.status());
                Assertions.assertEquals("timeout after 100 ms", failed.lastError());
                Assertions.assertEquals(1, runner.stats().freeSlots());
            }
            Assertions.assertEquals(1, interrupted.get());
            Assertions.assertEquals(1, runtime.deadLetters(10).size());
            Assertions.assertEquals("FAILED", runtime.taskStore().findByDedupKey("slow-1").orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void redeliveryOfCompletedTaskIsAckedWithoutRunning() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runner-dup-");
        try {
            LedgerRelayRuntime runtime = runtime(root, FAST_RETRY_SETTINGS);
            AtomicInteger calls = new AtomicInteger();
            TaskHandlerRegistry registry = new TaskHandlerRegistry().register(handler("count", ctx -> {
                calls.incrementAndGet();
                return TaskResult.ok(null);
            }));
            runtime.enqueue("count", "{}", "count-1");
            try (TaskRunner runner = runtime.newTaskRunner("w1", registry)) {
                drainUntilTerminal(runner, runtime, "count-1");

                MessageEnvelope duplicate = MessageEnvelope.task(LedgerRelayConfig.TASKS_TOPIC, "count",
                        Jsons.mapper().createObjectNode(), "count-1", false);
                runtime.broker().publish(duplicate.topic(), duplicate);
                Assertions.assertEquals(1, runner.dispatchOnce());
                Assertions.assertTrue(runner.awaitIdle(5_000L));
                Assertions.assertEquals(1L, runner.stats().duplicatesSkipped());
            }
            Assertions.assertEquals(1, calls.get());
            Assertions.assertEquals(1, runtime.tasks(null, 10, 0).size());
            Assertions.assertEquals(0, runtime.stats().processing());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void startedRunnerDrainsInBackground() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-runner-bg-");
        try {
            LedgerRelayRuntime runtime = runtime(root, FAST_RETRY_SETTINGS);
            for (int i = 0; i < 5; i++) {
                runtime.enqueue("echo", "{\"i\":" + i + "}", "bg-" + i);
            }
            try (TaskRunner runner = runtime.newTaskRunner("w1", new TaskHandlerRegistry().register(new EchoHandler()))) {
                runner.start();
                long deadline = System.currentTimeMillis() + 10_000L;
                while (runtime.tasks("SUCCEEDED", 10, 0).size() < 5 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(20L);
                }
            }
            Assertions.assertEquals(5, runtime.tasks("SUCCEEDED", 10, 0).size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static LedgerRelayRuntime runtime(Path root, String settingsJson) throws IOException {
        LedgerRelayConfig config = LedgerRelayConfig.fromRoot(root.toString());
        Files.createDirectories(config.settingsFile().getParent());
        Files.writeString(config.settingsFile(), settingsJson, StandardCharsets.UTF_8);
        LedgerRelayRuntime runtime = new LedgerRelayRuntime(config);
        runtime.init();
        return runtime;
    }

    private static TaskView drainUntilTerminal(TaskRunner runner, LedgerRelayRuntime runtime, String dedupKey)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000L;
        while (System.currentTimeMillis() < deadline) {
            runner.dispatchOnce();
            Assertions.assertTrue(runner.awaitIdle(5_000L));
            TaskView view = runtime.taskStore().findByDedupKey(dedupKey).orElse(null);
            if (view != null && ("SUCCEEDED".equals(view.status()) || "FAILED".equals(view.status()))) {
                return view;
            }
            Thread.sleep(5L);
        }
        throw new AssertionError("task " + dedupKey + " did not finish");
    }

    private static TaskHandler handler(String type, ThrowingHandler body) {
        return new TaskHandler() {
            @Override
            public String taskType() {
                return type;
            }

            @Override
            public TaskResult execute(TaskContext context) throws Exception {
                return body.apply(context);
            }
        };
    }

    @FunctionalInterface
    private interface ThrowingHandler {
        TaskResult apply(TaskContext context) throws Exception;
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
