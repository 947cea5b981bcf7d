package io.ledgerrelay.runtime;

import io.ledgerrelay.bus.Broker;
import io.ledgerrelay.bus.BrokerUnavailableException;
import io.ledgerrelay.bus.Delivery;
import io.ledgerrelay.config.RuntimeSettings;
import io.ledgerrelay.model.MessageEnvelope;
import io.ledgerrelay.observability.AuditLogger;
import io.ledgerrelay.storage.TaskStore;
import io.ledgerrelay.task.TaskContext;
import io.ledgerrelay.task.TaskExecutionException;
import io.ledgerrelay.task.TaskHandler;
import io.ledgerrelay.task.TaskHandlerRegistry;
import io.ledgerrelay.task.TaskResult;
import io.ledgerrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.stream.Stream;

public final class TaskRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final Broker broker;
    private final TaskStore taskStore;
    private final TaskHandlerRegistry registry;
    private final String consumerId;
    private final List<String> topics;
    private final Supplier<RuntimeSettings> settings;
    private final LongSupplier clock;
    private final AuditLogger auditLogger;
    private final int poolSize;
    private final Semaphore slots;
    private final ExecutorService executor;
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private int topicRotation;
    private Thread dispatchThread;

    public TaskRunner(Broker broker, TaskStore taskStore, TaskHandlerRegistry registry, String consumerId,
                      List<String> topics, Supplier<RuntimeSettings> settings, LongSupplier clock,
                      AuditLogger auditLogger) {
        this.broker = broker;
        this.taskStore = taskStore;
        this.registry = registry;
        this.consumerId = consumerId;
        this.topics = List.copyOf(topics);
        this.settings = settings;
        this.clock = clock;
        this.auditLogger = auditLogger;
        this.poolSize = Math.max(1, settings.get().workerPoolSize());
        this.slots = new Semaphore(poolSize);
        AtomicInteger threadIds = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ledgerrelay-task-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        int recovered = recover();
        log.info("Task runner {} starting with {} slot(s) on {}, recovered {} delivery(ies)",
                consumerId, poolSize, topics, recovered);
        dispatchThread = new Thread(this::dispatchLoop, "ledgerrelay-dispatch-" + consumerId);
        dispatchThread.start();
    }

    public int recover() {
        return broker.recover(consumerId);
    }

    private void dispatchLoop() {
        while (running.get()) {
            int dispatched;
            try {
                dispatched = dispatchOnce();
            } catch (RuntimeException e) {
                log.error("Dispatch round failed", e);
                dispatched = 0;
            }
            if (dispatched == 0) {
                try {
                    Thread.sleep(settings.get().dispatchIntervalMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    public int dispatchOnce() {
        expireTimedOut();
        republishDueRetries();
        int claimed = 0;
        int first = topicRotation++ % topics.size();
        for (int i = 0; i < topics.size(); i++) {
            String topic = topics.get((first + i) % topics.size());
            try {
                claimed += claimFrom(topic);
            } catch (BrokerUnavailableException e) {
                log.warn("Broker unavailable while consuming {}: {}", topic, e.getMessage());
            }
            if (slots.availablePermits() == 0) {
                break;
            }
        }
        return claimed;
    }

    private int claimFrom(String topic) {
        int claimed = 0;
        try (Stream<Delivery> deliveries = broker.consume(topic, consumerId)) {
            Iterator<Delivery> it = deliveries.iterator();
            while (slots.tryAcquire()) {
                boolean handedOff = false;
                try {
                    if (!it.hasNext()) {
                        break;
                    }
                    Delivery delivery = it.next();
                    claimed++;
                    handedOff = true;
                    dispatch(delivery);
                } finally {
                    if (!handedOff) {
                        slots.release();
                    }
                }
            }
        }
        return claimed;
    }

    // Takes ownership of one slot.
    private void dispatch(Delivery delivery) {
        MessageEnvelope envelope = delivery.envelope();
        long now = clock.getAsLong();
        RuntimeSettings current = settings.get();
        TaskStore.TaskRecord record;
        try {
            record = taskStore.recordDelivery(envelope, current.maxAttempts(), now);
            if (record.status().isTerminal() || inFlight.containsKey(record.taskId())) {
                skipDuplicate(delivery, record);
                return;
            }
            String leaseToken = UUID.randomUUID().toString();
            if (!taskStore.tryMarkRunning(record.taskId(), envelope.attempt(), consumerId, leaseToken, envelope.msgId(), now)) {
                skipDuplicate(delivery, record);
                return;
            }
            InFlight task = new InFlight(record.taskId(), leaseToken, delivery, now,
                    new TaskContext(record.taskId(), envelope.attempt(), record.maxAttempts(), envelope));
            inFlight.put(record.taskId(), task);
            task.future = executor.submit(() -> execute(task));
        } catch (RuntimeException e) {
            log.error("Failed to dispatch message {}; it stays claimed until the runner restarts", envelope.msgId(), e);
            slots.release();
        }
    }

    private void skipDuplicate(Delivery delivery, TaskStore.TaskRecord record) {
        try {
            broker.ack(delivery);
            duplicates.incrementAndGet();
            log.debug("Skipped duplicate delivery {} for task {} ({})", delivery.envelope().msgId(), record.taskId(), record.status());
        } finally {
            slots.release();
        }
    }

    private void execute(InFlight task) {
        TaskResult result;
        Optional<TaskHandler> handler = registry.findByType(task.context.taskType());
        if (handler.isEmpty()) {
            result = TaskResult.fatal("no handler registered for task type " + task.context.taskType());
        } else {
            try {
                result = handler.get().execute(task.context);
                if (result == null) {
                    result = TaskResult.fail("handler returned no result");
                }
            } catch (TaskExecutionException e) {
                result = new TaskResult(false, null, e.getMessage(), e.retryable());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result = TaskResult.fail("interrupted");
            } catch (Exception e) {
                result = TaskResult.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        complete(task, result);
    }

    private void complete(InFlight task, TaskResult result) {
        if (!task.settled.compareAndSet(false, true)) {
            log.info("Discarding late result of task {} (already settled)", task.taskId);
            return;
        }
        try {
            long now = clock.getAsLong();
            if (result.success()) {
                String output = result.output() == null ? null : Jsons.toCompactJson(result.output());
                if (!taskStore.tryMarkSuccess(task.taskId, task.leaseToken, output, now)) {
                    log.warn("Task {} lost its lease before success was recorded", task.taskId);
                }
                broker.ack(task.delivery);
                succeeded.incrementAndGet();
                return;
            }
            RuntimeSettings current = settings.get();
            TaskStore.RetryPolicy policy = new TaskStore.RetryPolicy(current.maxAttempts(), current.baseBackoffMs(), current.maxBackoffMs());
            TaskStore.FailureResolution resolution = taskStore.tryCompleteFailure(
                    task.taskId, task.leaseToken, result.error(), result.retryable(), now, policy);
            switch (resolution.outcome()) {
                case RETRY_SCHEDULED -> {
                    broker.retryLater(task.delivery);
                    retried.incrementAndGet();
                    log.info("Task {} attempt {} failed, retry at {}: {}", task.taskId, resolution.attempt(),
                            resolution.nextRetryAtMs(), result.error());
                }
                case DEAD_LETTERED -> {
                    broker.deadLetter(task.delivery);
                    deadLettered.incrementAndGet();
                    log.warn("Task {} failed after attempt {}, dead-lettered: {}", task.taskId, resolution.attempt(), result.error());
                    audit("task.dead_letter", task, "failed", Map.of(
                            "attempt", resolution.attempt(),
                            "error", String.valueOf(result.error())
                    ));
                }
                case STALE_LEASE -> {
                    log.warn("Task {} lost its lease before failure was recorded", task.taskId);
                    broker.ack(task.delivery);
                }
            }
        } catch (RuntimeException e) {
            log.error("Failed to record result of task {}; its delivery stays claimed until the runner restarts", task.taskId, e);
        } finally {
            inFlight.remove(task.taskId, task);
            slots.release();
        }
    }

    private void expireTimedOut() {
        long now = clock.getAsLong();
        long timeoutMs = settings.get().taskTimeoutMs();
        for (InFlight task : new ArrayList<>(inFlight.values())) {
            if (now - task.startedAtMs < timeoutMs || !task.settled.compareAndSet(false, true)) {
                continue;
            }
            String error = "timeout after " + timeoutMs + " ms";
            try {
                if (taskStore.markTimedOut(task.taskId, task.leaseToken, error, now)) {
                    broker.deadLetter(task.delivery);
                    deadLettered.incrementAndGet();
                    log.warn("Task {} timed out after {} ms, dead-lettered", task.taskId, timeoutMs);
                    audit("task.timeout", task, "failed", Map.of("timeout_ms", timeoutMs));
                } else {
                    broker.ack(task.delivery);
                }
            } catch (RuntimeException e) {
                log.error("Failed to expire task {}", task.taskId, e);
            } finally {
                inFlight.remove(task.taskId, task);
                slots.release();
                Future<?> future = task.future;
                if (future != null) {
                    future.cancel(true);
                }
            }
        }
    }

    private void republishDueRetries() {
        RuntimeSettings current = settings.get();
        long now = clock.getAsLong();
        for (TaskStore.RetryDispatch due : taskStore.dueRetries(now, current.retryDispatchLimit())) {
            MessageEnvelope next;
            try {
                next = Jsons.mapper().readValue(due.envelopeJson(), MessageEnvelope.class).redelivery(due.nextAttempt());
            } catch (IOException e) {
                throw new RuntimeException("Stored envelope of task " + due.taskId() + " is unreadable", e);
            }
            try {
                broker.publish(next.topic(), next);
            } catch (BrokerUnavailableException e) {
                log.warn("Broker unavailable, retry of task {} postponed: {}", due.taskId(), e.getMessage());
                return;
            }
            taskStore.markRequeued(due.taskId(), due.nextAttempt(), next.msgId(), now);
            broker.releaseParked(due.parkedMsgId());
            log.debug("Republished task {} as attempt {}", due.taskId(), due.nextAttempt());
        }
    }

    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!inFlight.isEmpty()) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            Thread.sleep(10L);
        }
        return true;
    }

    public RunnerStats stats() {
        return new RunnerStats(consumerId, poolSize, inFlight.size(), slots.availablePermits(),
                succeeded.get(), retried.get(), deadLettered.get(), duplicates.get());
    }

    @Override
    public void close() {
        running.set(false);
        Thread t;
        synchronized (this) {
            t = dispatchThread;
            dispatchThread = null;
        }
        if (t != null) {
            t.interrupt();
            try {
                t.join(5_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void audit(String action, InFlight task, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>(details);
        row.put("task_type", task.context.taskType());
        row.put("dedup_key", task.context.envelope().dedupKey());
        row.put("msg_id", task.context.envelope().msgId());
        auditLogger.log(AuditLogger.AuditEvent.of(action, "worker:" + consumerId, "task/" + task.taskId, result, task.taskId, row));
    }

    public record RunnerStats(String consumerId, int poolSize, int inFlight, int freeSlots,
                              long succeeded, long retried, long deadLettered, long duplicatesSkipped) {
    }

    private static final class InFlight {
        final String taskId;
        final String leaseToken;
        final Delivery delivery;
        final long startedAtMs;
        final TaskContext context;
        final AtomicBoolean settled = new AtomicBoolean(false);
        volatile Future<?> future;

        InFlight(String taskId, String leaseToken, Delivery delivery, long startedAtMs, TaskContext context) {
            this.taskId = taskId;
            this.leaseToken = leaseToken;
            this.delivery = delivery;
            this.startedAtMs = startedAtMs;
            this.context = context;
        }
    }
}
