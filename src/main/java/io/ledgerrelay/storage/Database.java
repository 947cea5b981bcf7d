package io.ledgerrelay.storage;

import io.ledgerrelay.config.LedgerRelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "ledgerrelay.schema.migration.v1";
    private static final String BUSY_TIMEOUT_MS = "5000";

    private final LedgerRelayConfig config;
    private final String jdbcUrl;

    public Database(LedgerRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public LedgerRelayConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", BUSY_TIMEOUT_MS);
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.topicsRoot());
            Files.createDirectories(config.processingDir());
            Files.createDirectories(config.doneRoot());
            Files.createDirectories(config.retryRoot());
            Files.createDirectories(config.deadRoot());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        task_id TEXT PRIMARY KEY,
                        task_type TEXT NOT NULL,
                        dedup_key TEXT NOT NULL UNIQUE,
                        status TEXT NOT NULL,
                        attempt INTEGER NOT NULL,
                        max_attempts INTEGER NOT NULL,
                        payload TEXT NOT NULL,
                        result TEXT,
                        last_error TEXT,
                        next_retry_at_ms INTEGER,
                        lease_owner TEXT,
                        lease_token TEXT,
                        source_msg_id TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS schedule_entries (
                        name TEXT PRIMARY KEY,
                        task_type TEXT NOT NULL,
                        interval_ms INTEGER NOT NULL,
                        last_fired_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schedule_outbox (
                        dedup_key TEXT PRIMARY KEY,
                        schedule_name TEXT NOT NULL,
                        window_start_ms INTEGER NOT NULL,
                        envelope_json TEXT NOT NULL,
                        published INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        published_at_ms INTEGER
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS ledger_cursors (
                        watcher_id TEXT PRIMARY KEY,
                        cursor TEXT NOT NULL,
                        position INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS anchor_transactions (
                        id TEXT PRIMARY KEY,
                        kind TEXT NOT NULL,
                        status TEXT NOT NULL,
                        asset_code TEXT NOT NULL,
                        stellar_account TEXT,
                        amount_in TEXT,
                        amount_fee TEXT,
                        amount_out TEXT,
                        memo TEXT,
                        memo_type TEXT,
                        stellar_transaction_id TEXT,
                        started_at_ms INTEGER NOT NULL,
                        completed_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureAddedColumns(conn);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_status_next_retry ON tasks(status, next_retry_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_status_updated ON tasks(status, updated_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_schedule_outbox_published ON schedule_outbox(published, created_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureAddedColumns(Connection conn) throws SQLException {
        ensureColumn(conn, "tasks", "envelope_json", "TEXT NOT NULL DEFAULT ''");
        ensureColumn(conn, "anchor_transactions", "amount_out", "TEXT");
    }

    private void ensureColumn(Connection conn, String table, String column, String definition) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        if (!columns.contains(column)) {
            try (Statement st = conn.createStatement()) {
                st.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " " + definition);
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_anchor_lookup_indexes",
                "Index anchor transactions by status and memo",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_anchor_tx_kind_status ON anchor_transactions(kind, status)",
                        "CREATE INDEX IF NOT EXISTS idx_anchor_tx_memo ON anchor_transactions(memo)"
                )
        ));
        steps.add(new MigrationStep(
                "20260301_002_schedule_outbox_window",
                "Index schedule outbox by schedule window",
                List.of("CREATE INDEX IF NOT EXISTS idx_schedule_outbox_window ON schedule_outbox(schedule_name, window_start_ms)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
            log.info("Applied schema migration {}", step.version());
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            validatePragma(st, "journal_mode", "wal");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        String sql = "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version";
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
