package io.ledgerrelay.storage;

import io.ledgerrelay.model.AnchorStatus;
import io.ledgerrelay.model.AnchorTransaction;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class AnchorTransactionStore {
    private static final String COLUMNS =
            "id,kind,status,asset_code,stellar_account,amount_in,amount_fee,amount_out,memo,memo_type,stellar_transaction_id,started_at_ms,completed_at_ms,updated_at_ms";

    private final Database database;

    public AnchorTransactionStore(Database database) {
        this.database = database;
    }

    public void insert(AnchorTransaction tx) {
        String sql = "INSERT INTO anchor_transactions(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, tx.id());
            ps.setString(2, tx.kind());
            ps.setString(3, tx.status());
            ps.setString(4, tx.assetCode());
            ps.setString(5, tx.stellarAccount());
            ps.setString(6, tx.amountIn());
            ps.setString(7, tx.amountFee());
            ps.setString(8, tx.amountOut());
            ps.setString(9, tx.memo());
            ps.setString(10, tx.memoType());
            ps.setString(11, tx.stellarTransactionId());
            ps.setLong(12, tx.startedAtMs());
            if (tx.completedAtMs() == null) {
                ps.setNull(13, Types.INTEGER);
            } else {
                ps.setLong(13, tx.completedAtMs());
            }
            ps.setLong(14, tx.updatedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert anchor transaction: " + tx.id(), e);
        }
    }

    public Optional<AnchorTransaction> get(String id) {
        List<AnchorTransaction> rows = query("SELECT " + COLUMNS + " FROM anchor_transactions WHERE id=?", id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<AnchorTransaction> list(String kind, String status, int limit) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM anchor_transactions WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (kind != null && !kind.isBlank()) {
            sql.append(" AND kind=?");
            args.add(kind.trim());
        }
        if (status != null && !status.isBlank()) {
            sql.append(" AND status=?");
            args.add(AnchorStatus.fromString(status).wireName());
        }
        sql.append(" ORDER BY started_at_ms DESC, id LIMIT ?");
        args.add(Math.max(1, limit));
        return query(sql.toString(), args.toArray());
    }

    public List<AnchorTransaction> listByStatus(String kind, AnchorStatus status) {
        return query("SELECT " + COLUMNS + " FROM anchor_transactions WHERE kind=? AND status=? ORDER BY started_at_ms, id",
                kind, status.wireName());
    }

    public List<AnchorTransaction> findAwaitingWithdrawals(String memo) {
        return query("SELECT " + COLUMNS + " FROM anchor_transactions WHERE kind=? AND status=? AND memo=? ORDER BY started_at_ms, id",
                AnchorTransaction.KIND_WITHDRAWAL, AnchorStatus.PENDING_USER_TRANSFER_START.wireName(), memo);
    }

    public Optional<AnchorTransaction> findByStellarTransactionId(String hash) {
        List<AnchorTransaction> rows = query(
                "SELECT " + COLUMNS + " FROM anchor_transactions WHERE stellar_transaction_id=? LIMIT 1", hash);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public boolean completeWithdrawal(String id, String hash, long completedAtMs, long nowMs) {
        String sql = """
                UPDATE anchor_transactions SET status=?,stellar_transaction_id=?,completed_at_ms=?,updated_at_ms=?
                WHERE id=? AND kind=? AND status=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, AnchorStatus.COMPLETED.wireName());
            ps.setString(2, hash);
            ps.setLong(3, completedAtMs);
            ps.setLong(4, nowMs);
            ps.setString(5, id);
            ps.setString(6, AnchorTransaction.KIND_WITHDRAWAL);
            ps.setString(7, AnchorStatus.PENDING_USER_TRANSFER_START.wireName());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete withdrawal: " + id, e);
        }
    }

    public boolean completeDeposit(String id, String hash, String amountOut, long nowMs) {
        String sql = """
                UPDATE anchor_transactions SET status=?,stellar_transaction_id=?,amount_out=?,completed_at_ms=?,updated_at_ms=?
                WHERE id=? AND kind=? AND status=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, AnchorStatus.COMPLETED.wireName());
            ps.setString(2, hash);
            ps.setString(3, amountOut);
            ps.setLong(4, nowMs);
            ps.setLong(5, nowMs);
            ps.setString(6, id);
            ps.setString(7, AnchorTransaction.KIND_DEPOSIT);
            ps.setString(8, AnchorStatus.PENDING_STELLAR.wireName());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete deposit: " + id, e);
        }
    }

    public boolean transition(String id, AnchorStatus from, AnchorStatus to, long nowMs) {
        String sql = "UPDATE anchor_transactions SET status=?,updated_at_ms=? WHERE id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, to.wireName());
            ps.setLong(2, nowMs);
            ps.setString(3, id);
            ps.setString(4, from.wireName());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update anchor transaction: " + id, e);
        }
    }

    private List<AnchorTransaction> query(String sql, Object... args) {
        List<AnchorTransaction> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long completed = rs.getLong("completed_at_ms");
                    Long completedAtMs = rs.wasNull() ? null : completed;
                    out.add(new AnchorTransaction(
                            rs.getString("id"),
                            rs.getString("kind"),
                            rs.getString("status"),
                            rs.getString("asset_code"),
                            rs.getString("stellar_account"),
                            rs.getString("amount_in"),
                            rs.getString("amount_fee"),
                            rs.getString("amount_out"),
                            rs.getString("memo"),
                            rs.getString("memo_type"),
                            rs.getString("stellar_transaction_id"),
                            rs.getLong("started_at_ms"),
                            completedAtMs,
                            rs.getLong("updated_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query anchor transactions", e);
        }
    }
}
