package io.ledgerrelay.storage;

import io.ledgerrelay.model.MessageEnvelope;
import io.ledgerrelay.model.TaskStatus;
import io.ledgerrelay.model.TaskView;
import io.ledgerrelay.util.Backoff;
import io.ledgerrelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public final class TaskStore {
    private static final String VIEW_COLUMNS =
            "task_id,task_type,dedup_key,status,attempt,max_attempts,payload,result,last_error,next_retry_at_ms,created_at_ms,updated_at_ms";

    private final Database database;

    public TaskStore(Database database) {
        this.database = database;
    }

    public TaskRecord recordDelivery(MessageEnvelope envelope, int maxAttempts, long nowMs) {
        String insert = """
                INSERT OR IGNORE INTO tasks(task_id,task_type,dedup_key,status,attempt,max_attempts,payload,
                    source_msg_id,envelope_json,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(insert)) {
            ps.setString(1, "task_" + UUID.randomUUID());
            ps.setString(2, envelope.taskType());
            ps.setString(3, envelope.dedupKey());
            ps.setString(4, TaskStatus.QUEUED.name());
            ps.setInt(5, envelope.attempt());
            ps.setInt(6, Math.max(1, maxAttempts));
            ps.setString(7, Jsons.toCompactJson(envelope.payload()));
            ps.setString(8, envelope.msgId());
            ps.setString(9, Jsons.toCompactJson(envelope));
            ps.setLong(10, nowMs);
            ps.setLong(11, nowMs);
            boolean created = ps.executeUpdate() == 1;
            TaskRecord existing = readRecord(c, envelope.dedupKey())
                    .orElseThrow(() -> new IllegalStateException("task row missing after insert: " + envelope.dedupKey()));
            return created ? existing.asCreated() : existing;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record delivery: " + envelope.msgId(), e);
        }
    }

    public boolean tryMarkRunning(String taskId, int attempt, String leaseOwner, String leaseToken, String msgId, long nowMs) {
        String sql = """
                UPDATE tasks SET status=?,attempt=?,lease_owner=?,lease_token=?,source_msg_id=?,next_retry_at_ms=NULL,updated_at_ms=?
                WHERE task_id=? AND (
                    (status=? AND attempt<=?) OR (status=? AND attempt<?) OR (status=? AND attempt<=?)
                )
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.RUNNING.name());
            ps.setInt(2, attempt);
            ps.setString(3, leaseOwner);
            ps.setString(4, leaseToken);
            ps.setString(5, msgId);
            ps.setLong(6, nowMs);
            ps.setString(7, taskId);
            ps.setString(8, TaskStatus.QUEUED.name());
            ps.setInt(9, attempt);
            ps.setString(10, TaskStatus.RETRYING.name());
            ps.setInt(11, attempt);
            ps.setString(12, TaskStatus.RUNNING.name());
            ps.setInt(13, attempt);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed mark running: " + taskId, e);
        }
    }

    public boolean tryMarkSuccess(String taskId, String leaseToken, String resultJson, long nowMs) {
        String sql = """
                UPDATE tasks SET status=?,result=?,last_error=NULL,lease_owner=NULL,lease_token=NULL,next_retry_at_ms=NULL,updated_at_ms=?
                WHERE task_id=? AND status=? AND lease_token=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.SUCCEEDED.name());
            ps.setString(2, resultJson);
            ps.setLong(3, nowMs);
            ps.setString(4, taskId);
            ps.setString(5, TaskStatus.RUNNING.name());
            ps.setString(6, leaseToken);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed mark success: " + taskId, e);
        }
    }

    public FailureResolution tryCompleteFailure(String taskId, String leaseToken, String error, boolean retryable,
                                                long nowMs, RetryPolicy policy) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement read = c.prepareStatement("SELECT attempt,max_attempts,status,lease_token FROM tasks WHERE task_id=?");
                 PreparedStatement setFailed = c.prepareStatement(
                         "UPDATE tasks SET status=?,last_error=?,lease_owner=NULL,lease_token=NULL,next_retry_at_ms=NULL,updated_at_ms=? WHERE task_id=? AND lease_token=?");
                 PreparedStatement setRetry = c.prepareStatement(
                         "UPDATE tasks SET status=?,last_error=?,lease_owner=NULL,lease_token=NULL,next_retry_at_ms=?,updated_at_ms=? WHERE task_id=? AND lease_token=?")) {
                read.setString(1, taskId);
                int attempt;
                int maxAttempts;
                try (ResultSet rs = read.executeQuery()) {
                    if (!rs.next()
                            || !TaskStatus.RUNNING.name().equals(rs.getString("status"))
                            || !leaseToken.equals(rs.getString("lease_token"))) {
                        c.rollback();
                        return FailureResolution.staleLease();
                    }
                    attempt = rs.getInt("attempt");
                    maxAttempts = rs.getInt("max_attempts");
                }
                if (!retryable || attempt >= maxAttempts) {
                    setFailed.setString(1, TaskStatus.FAILED.name());
                    setFailed.setString(2, error);
                    setFailed.setLong(3, nowMs);
                    setFailed.setString(4, taskId);
                    setFailed.setString(5, leaseToken);
                    setFailed.executeUpdate();
                    c.commit();
                    return FailureResolution.deadLetter(attempt);
                }
                long nextRetryAtMs = nowMs + policy.backoff().delayMs(attempt);
                setRetry.setString(1, TaskStatus.RETRYING.name());
                setRetry.setString(2, error);
                setRetry.setLong(3, nextRetryAtMs);
                setRetry.setLong(4, nowMs);
                setRetry.setString(5, taskId);
                setRetry.setString(6, leaseToken);
                setRetry.executeUpdate();
                c.commit();
                return FailureResolution.retryScheduled(attempt, nextRetryAtMs);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed complete failure: " + taskId, e);
        }
    }

    // Clears the lease, so the handler's eventual result is discarded.
    public boolean markTimedOut(String taskId, String leaseToken, String error, long nowMs) {
        String sql = """
                UPDATE tasks SET status=?,last_error=?,lease_owner=NULL,lease_token=NULL,next_retry_at_ms=NULL,updated_at_ms=?
                WHERE task_id=? AND status=? AND lease_token=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.FAILED.name());
            ps.setString(2, error);
            ps.setLong(3, nowMs);
            ps.setString(4, taskId);
            ps.setString(5, TaskStatus.RUNNING.name());
            ps.setString(6, leaseToken);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed mark timed out: " + taskId, e);
        }
    }

    public List<RetryDispatch> dueRetries(long nowMs, int limit) {
        String sql = """
                SELECT task_id,attempt,source_msg_id,envelope_json FROM tasks
                WHERE status=? AND next_retry_at_ms IS NOT NULL AND next_retry_at_ms<=?
                ORDER BY next_retry_at_ms ASC LIMIT ?
                """;
        List<RetryDispatch> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.RETRYING.name());
            ps.setLong(2, nowMs);
            ps.setInt(3, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new RetryDispatch(
                            rs.getString("task_id"),
                            rs.getInt("attempt") + 1,
                            rs.getString("source_msg_id"),
                            rs.getString("envelope_json")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed claim retries", e);
        }
    }

    public boolean markRequeued(String taskId, int nextAttempt, String msgId, long nowMs) {
        String sql = """
                UPDATE tasks SET status=?,attempt=?,source_msg_id=?,next_retry_at_ms=NULL,updated_at_ms=?
                WHERE task_id=? AND status=? AND attempt<?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.QUEUED.name());
            ps.setInt(2, nextAttempt);
            ps.setString(3, msgId);
            ps.setLong(4, nowMs);
            ps.setString(5, taskId);
            ps.setString(6, TaskStatus.RETRYING.name());
            ps.setInt(7, nextAttempt);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed mark requeued: " + taskId, e);
        }
    }

    public Optional<ReplayTicket> prepareReplay(String taskId, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement read = c.prepareStatement("SELECT status,envelope_json FROM tasks WHERE task_id=?");
                 PreparedStatement up = c.prepareStatement(
                         "UPDATE tasks SET status=?,attempt=1,next_retry_at_ms=NULL,updated_at_ms=? WHERE task_id=? AND status=?")) {
                read.setString(1, taskId);
                String envelopeJson;
                try (ResultSet rs = read.executeQuery()) {
                    if (!rs.next() || !TaskStatus.FAILED.name().equals(rs.getString("status"))) {
                        c.rollback();
                        return Optional.empty();
                    }
                    envelopeJson = rs.getString("envelope_json");
                }
                up.setString(1, TaskStatus.QUEUED.name());
                up.setLong(2, nowMs);
                up.setString(3, taskId);
                up.setString(4, TaskStatus.FAILED.name());
                if (up.executeUpdate() == 0) {
                    c.rollback();
                    return Optional.empty();
                }
                c.commit();
                return Optional.of(new ReplayTicket(taskId, envelopeJson));
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed prepare replay: " + taskId, e);
        }
    }

    public void revertReplay(String taskId, String error, long nowMs) {
        String sql = "UPDATE tasks SET status=?,last_error=?,updated_at_ms=? WHERE task_id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.FAILED.name());
            ps.setString(2, error);
            ps.setLong(3, nowMs);
            ps.setString(4, taskId);
            ps.setString(5, TaskStatus.QUEUED.name());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed revert replay: " + taskId, e);
        }
    }

    public Optional<TaskView> getTask(String taskId) {
        return findOne("SELECT " + VIEW_COLUMNS + " FROM tasks WHERE task_id=?", taskId);
    }

    public Optional<TaskView> findByDedupKey(String dedupKey) {
        return findOne("SELECT " + VIEW_COLUMNS + " FROM tasks WHERE dedup_key=?", dedupKey);
    }

    public List<TaskView> listTasks(String status, int limit, int offset) {
        boolean withStatus = status != null && !status.isBlank();
        String sql = "SELECT " + VIEW_COLUMNS + " FROM tasks"
                + (withStatus ? " WHERE status=?" : "")
                + " ORDER BY updated_at_ms DESC, task_id LIMIT ? OFFSET ?";
        List<TaskView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            if (withStatus) {
                ps.setString(i++, TaskStatus.valueOf(status.trim().toUpperCase(Locale.ROOT)).name());
            }
            ps.setInt(i++, Math.max(1, limit));
            ps.setInt(i, Math.max(0, offset));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readView(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks", e);
        }
    }

    public Map<String, Integer> countByStatus() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (TaskStatus status : TaskStatus.values()) {
            out.put(status.name(), 0);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(1) AS c FROM tasks GROUP BY status");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString(1), rs.getInt(2));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to collect task stats", e);
        }
    }

    private Optional<TaskView> findOne(String sql, String key) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readView(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load task: " + key, e);
        }
    }

    private Optional<TaskRecord> readRecord(Connection c, String dedupKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT task_id,task_type,status,attempt,max_attempts FROM tasks WHERE dedup_key=?")) {
            ps.setString(1, dedupKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new TaskRecord(
                        rs.getString("task_id"),
                        rs.getString("task_type"),
                        dedupKey,
                        TaskStatus.valueOf(rs.getString("status")),
                        rs.getInt("attempt"),
                        rs.getInt("max_attempts"),
                        false
                ));
            }
        }
    }

    private TaskView readView(ResultSet rs) throws SQLException {
        long nextRetry = rs.getLong("next_retry_at_ms");
        Long nextRetryAtMs = rs.wasNull() ? null : nextRetry;
        return new TaskView(
                rs.getString("task_id"),
                rs.getString("task_type"),
                rs.getString("dedup_key"),
                rs.getString("status"),
                rs.getInt("attempt"),
                rs.getInt("max_attempts"),
                rs.getString("payload"),
                rs.getString("result"),
                rs.getString("last_error"),
                nextRetryAtMs,
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    public record TaskRecord(String taskId, String taskType, String dedupKey, TaskStatus status,
                             int attempt, int maxAttempts, boolean created) {
        TaskRecord asCreated() {
            return new TaskRecord(taskId, taskType, dedupKey, status, attempt, maxAttempts, true);
        }
    }

    public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        public Backoff backoff() {
            return new Backoff(baseBackoffMs, maxBackoffMs);
        }
    }

    public enum FailureOutcome { RETRY_SCHEDULED, DEAD_LETTERED, STALE_LEASE }

    public record FailureResolution(FailureOutcome outcome, int attempt, Long nextRetryAtMs) {
        public static FailureResolution retryScheduled(int attempt, long nextRetryAtMs) {
            return new FailureResolution(FailureOutcome.RETRY_SCHEDULED, attempt, nextRetryAtMs);
        }

        public static FailureResolution deadLetter(int attempt) {
            return new FailureResolution(FailureOutcome.DEAD_LETTERED, attempt, null);
        }

        public static FailureResolution staleLease() {
            return new FailureResolution(FailureOutcome.STALE_LEASE, 0, null);
        }
    }

    public record RetryDispatch(String taskId, int nextAttempt, String parkedMsgId, String envelopeJson) {
    }

    public record ReplayTicket(String taskId, String envelopeJson) {
    }
}
