package io.ledgerrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class LedgerRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "ledgerrelay-settings.json";
    public static final String TASKS_TOPIC = "tasks";
    public static final String LEDGER_TOPIC = "ledger.transactions";
    public static final long DEFAULT_PAYLOAD_MAX_BYTES = 1024L * 1024L;

    private final Path rootDir;

    public LedgerRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static LedgerRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new LedgerRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("ledgerrelay.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path brokerRoot() {
        return rootDir.resolve("broker");
    }

    public Path topicsRoot() {
        return brokerRoot().resolve("topics");
    }

    public Path topicInbox(String topic) {
        return topicsRoot().resolve(topic);
    }

    public Path processingDir() {
        return brokerRoot().resolve("processing");
    }

    public Path doneRoot() {
        return brokerRoot().resolve("done");
    }

    public Path retryRoot() {
        return brokerRoot().resolve("retry");
    }

    public Path deadRoot() {
        return brokerRoot().resolve("dead");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
