package io.ledgerrelay.storage;

import io.ledgerrelay.config.ScheduleDefinition;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class ScheduleStore {
    private final Database database;

    public ScheduleStore(Database database) {
        this.database = database;
    }

    public void syncEntries(List<ScheduleDefinition> definitions, long nowMs) {
        String upsert = """
                INSERT INTO schedule_entries(name,task_type,interval_ms,last_fired_ms,updated_at_ms) VALUES(?,?,?,NULL,?)
                ON CONFLICT(name) DO UPDATE SET task_type=excluded.task_type,interval_ms=excluded.interval_ms,updated_at_ms=excluded.updated_at_ms
                """;
        Set<String> names = new HashSet<>();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement(upsert);
                 PreparedStatement list = c.prepareStatement("SELECT name FROM schedule_entries");
                 PreparedStatement del = c.prepareStatement("DELETE FROM schedule_entries WHERE name=?")) {
                for (ScheduleDefinition def : definitions) {
                    names.add(def.name());
                    up.setString(1, def.name());
                    up.setString(2, def.taskType());
                    up.setLong(3, def.intervalMs());
                    up.setLong(4, nowMs);
                    up.executeUpdate();
                }
                List<String> stale = new ArrayList<>();
                try (ResultSet rs = list.executeQuery()) {
                    while (rs.next()) {
                        if (!names.contains(rs.getString(1))) {
                            stale.add(rs.getString(1));
                        }
                    }
                }
                for (String name : stale) {
                    del.setString(1, name);
                    del.executeUpdate();
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to sync schedule entries", e);
        }
    }

    // Empty when the window already fired.
    public Optional<OutboxRow> tryFire(String name, long windowStartMs, String dedupKey, String envelopeJson, long nowMs) {
        String claim = "UPDATE schedule_entries SET last_fired_ms=?,updated_at_ms=? WHERE name=? AND (last_fired_ms IS NULL OR last_fired_ms<?)";
        String outbox = """
                INSERT OR IGNORE INTO schedule_outbox(dedup_key,schedule_name,window_start_ms,envelope_json,published,created_at_ms)
                VALUES(?,?,?,?,0,?)
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement(claim); PreparedStatement ins = c.prepareStatement(outbox)) {
                up.setLong(1, windowStartMs);
                up.setLong(2, nowMs);
                up.setString(3, name);
                up.setLong(4, windowStartMs);
                if (up.executeUpdate() == 0) {
                    c.rollback();
                    return Optional.empty();
                }
                ins.setString(1, dedupKey);
                ins.setString(2, name);
                ins.setLong(3, windowStartMs);
                ins.setString(4, envelopeJson);
                ins.setLong(5, nowMs);
                if (ins.executeUpdate() == 0) {
                    c.rollback();
                    return Optional.empty();
                }
                c.commit();
                return Optional.of(new OutboxRow(dedupKey, name, windowStartMs, envelopeJson, false, nowMs));
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to fire schedule: " + name, e);
        }
    }

    public List<OutboxRow> pendingOutbox(int limit) {
        String sql = """
                SELECT dedup_key,schedule_name,window_start_ms,envelope_json,published,created_at_ms FROM schedule_outbox
                WHERE published=0 ORDER BY created_at_ms ASC, dedup_key ASC LIMIT ?
                """;
        List<OutboxRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new OutboxRow(
                            rs.getString("dedup_key"),
                            rs.getString("schedule_name"),
                            rs.getLong("window_start_ms"),
                            rs.getString("envelope_json"),
                            rs.getInt("published") == 1,
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load schedule outbox", e);
        }
    }

    public boolean markPublished(String dedupKey, long nowMs) {
        String sql = "UPDATE schedule_outbox SET published=1,published_at_ms=? WHERE dedup_key=? AND published=0";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, dedupKey);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark outbox row published: " + dedupKey, e);
        }
    }

    public int countOutbox(String scheduleName) {
        String sql = "SELECT COUNT(1) FROM schedule_outbox WHERE schedule_name=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, scheduleName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count outbox rows: " + scheduleName, e);
        }
    }

    public List<ScheduleEntry> listEntries() {
        String sql = """
                SELECT e.name,e.task_type,e.interval_ms,e.last_fired_ms,e.updated_at_ms,
                    (SELECT COUNT(1) FROM schedule_outbox o WHERE o.schedule_name=e.name AND o.published=0) AS pending
                FROM schedule_entries e ORDER BY e.name
                """;
        List<ScheduleEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long lastFired = rs.getLong("last_fired_ms");
                Long lastFiredMs = rs.wasNull() ? null : lastFired;
                out.add(new ScheduleEntry(
                        rs.getString("name"),
                        rs.getString("task_type"),
                        rs.getLong("interval_ms"),
                        lastFiredMs,
                        rs.getInt("pending"),
                        rs.getLong("updated_at_ms")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schedule entries", e);
        }
    }

    public record ScheduleEntry(String name, String taskType, long intervalMs, Long lastFiredMs,
                                int pendingOutbox, long updatedAtMs) {
    }

    public record OutboxRow(String dedupKey, String scheduleName, long windowStartMs, String envelopeJson,
                            boolean published, long createdAtMs) {
    }
}
