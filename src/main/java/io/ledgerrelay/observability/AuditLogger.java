package io.ledgerrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.ledgerrelay.util.Hashing;
import io.ledgerrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException e) {
                    log.debug("Audit log {} created concurrently", auditFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("task_id", event.taskId());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized int verifyChain() {
        String expectedPrev = "";
        int rows = 0;
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            for (String line : lines) {
                if (line.isBlank()) {
                    continue;
                }
                rows++;
                JsonNode node = Jsons.readTree(line);
                String hash = node.path("hash").asText("");
                if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                    throw new IllegalStateException("Audit chain broken at row " + rows + ": prev_hash mismatch");
                }
                Map<?, ?> body = Jsons.mapper().convertValue(node, LinkedHashMap.class);
                body.remove("hash");
                if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(body)))) {
                    throw new IllegalStateException("Audit chain broken at row " + rows + ": hash mismatch");
                }
                expectedPrev = hash;
            }
            return rows;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.readTree(last).path("hash").asText("");
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Audit log {} has an unreadable tail, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String taskId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result,
                                    String taskId, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, taskId, details == null ? Map.of() : details);
        }
    }
}
