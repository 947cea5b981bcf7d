package io.ledgerrelay.storage;

import io.ledgerrelay.ledger.LedgerTransaction;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

public final class CheckpointStore {
    private final Database database;

    public CheckpointStore(Database database) {
        this.database = database;
    }

    public Optional<Checkpoint> load(String watcherId) {
        String sql = "SELECT watcher_id,cursor,position,updated_at_ms FROM ledger_cursors WHERE watcher_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, watcherId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Checkpoint checkpoint = new Checkpoint(
                        rs.getString("watcher_id"),
                        rs.getString("cursor"),
                        rs.getLong("position"),
                        rs.getLong("updated_at_ms")
                );
                if (LedgerTransaction.parsePosition(checkpoint.cursor()) != checkpoint.position()) {
                    throw new IllegalStateException("Corrupt checkpoint for watcher " + watcherId + ": cursor="
                            + checkpoint.cursor() + ", position=" + checkpoint.position());
                }
                return Optional.of(checkpoint);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load checkpoint: " + watcherId, e);
        }
    }

    // Never moves backwards; reset() is the operator escape hatch.
    public boolean advance(String watcherId, String cursor, long nowMs) {
        long position = LedgerTransaction.parsePosition(cursor);
        if (position < 0L) {
            throw new IllegalArgumentException("cursor is not a ledger position: " + cursor);
        }
        String insert = "INSERT OR IGNORE INTO ledger_cursors(watcher_id,cursor,position,updated_at_ms) VALUES(?,?,?,?)";
        String update = "UPDATE ledger_cursors SET cursor=?,position=?,updated_at_ms=? WHERE watcher_id=? AND position<?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ins = c.prepareStatement(insert); PreparedStatement up = c.prepareStatement(update)) {
                ins.setString(1, watcherId);
                ins.setString(2, cursor.trim());
                ins.setLong(3, position);
                ins.setLong(4, nowMs);
                boolean changed = ins.executeUpdate() == 1;
                if (!changed) {
                    up.setString(1, cursor.trim());
                    up.setLong(2, position);
                    up.setLong(3, nowMs);
                    up.setString(4, watcherId);
                    up.setLong(5, position);
                    changed = up.executeUpdate() == 1;
                }
                c.commit();
                return changed;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to advance checkpoint: " + watcherId, e);
        }
    }

    public void reset(String watcherId, String cursor, long nowMs) {
        if (cursor == null || cursor.isBlank()) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("DELETE FROM ledger_cursors WHERE watcher_id=?")) {
                ps.setString(1, watcherId);
                ps.executeUpdate();
                return;
            } catch (SQLException e) {
                throw new RuntimeException("Failed to clear checkpoint: " + watcherId, e);
            }
        }
        long position = LedgerTransaction.parsePosition(cursor);
        if (position < 0L) {
            throw new IllegalArgumentException("cursor is not a ledger position: " + cursor);
        }
        String sql = "INSERT OR REPLACE INTO ledger_cursors(watcher_id,cursor,position,updated_at_ms) VALUES(?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, watcherId);
            ps.setString(2, cursor.trim());
            ps.setLong(3, position);
            ps.setLong(4, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reset checkpoint: " + watcherId, e);
        }
    }

    public record Checkpoint(String watcherId, String cursor, long position, long updatedAtMs) {
    }
}
