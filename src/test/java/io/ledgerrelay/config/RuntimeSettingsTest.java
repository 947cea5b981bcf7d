package io.ledgerrelay.config;

import io.ledgerrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class RuntimeSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-settings-default-");
        try {
            RuntimeSettings settings = RuntimeSettings.load(root.resolve("absent.json"));
            Assertions.assertEquals(RuntimeSettings.defaults(), settings);
            Assertions.assertEquals(4, settings.workerPoolSize());
            Assertions.assertEquals(3, settings.maxAttempts());
            Assertions.assertEquals(1, settings.schedules().size());
            Assertions.assertEquals("check_trustlines", settings.schedules().get(0).taskType());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreSanitized() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-settings-load-");
        try {
            Path file = root.resolve("settings.json");
            Files.writeString(file, """
                    {
                      "horizonUrl": "https://horizon.example.org//",
                      "watchedAccount": " GANCHOR ",
                      "watcherId": " Main ",
                      "pageLimit": 5000,
                      "pollIntervalMs": 1,
                      "memoTypes": ["TEXT", " ", "id", "text"],
                      "workerPoolSize": 0,
                      "baseBackoffMs": 500,
                      "maxBackoffMs": 10,
                      "taskTimeoutMs": 5,
                      "dispatchIntervalMs": 1,
                      "unknownField": true,
                      "schedules": [
                        {"name": "sweep", "taskType": "check_trustlines", "intervalMs": 30000, "payload": {"deep": true}}
                      ]
                    }
                    """, StandardCharsets.UTF_8);
            RuntimeSettings settings = RuntimeSettings.load(file);
            Assertions.assertEquals("https://horizon.example.org", settings.horizonUrl());
            Assertions.assertEquals("GANCHOR", settings.watchedAccount());
            Assertions.assertEquals("main", settings.watcherId());
            Assertions.assertEquals(RuntimeSettings.MAX_PAGE_LIMIT, settings.pageLimit());
            Assertions.assertEquals(100L, settings.pollIntervalMs());
            Assertions.assertEquals(List.of("text", "id"), settings.memoTypes());
            Assertions.assertEquals(1, settings.workerPoolSize());
            Assertions.assertEquals(500L, settings.baseBackoffMs());
            Assertions.assertEquals(500L, settings.maxBackoffMs());
            Assertions.assertEquals(100L, settings.taskTimeoutMs());
            Assertions.assertEquals(10L, settings.dispatchIntervalMs());
            Assertions.assertEquals(3, settings.maxAttempts());

            ScheduleDefinition sweep = settings.schedules().get(0);
            Assertions.assertEquals("sweep", sweep.name());
            Assertions.assertEquals(30_000L, sweep.intervalMs());
            Assertions.assertTrue(sweep.payload().path("deep").asBoolean());
            Assertions.assertEquals(60_000L, sweep.windowStart(89_999L));

            List<String> changed = RuntimeSettings.defaults().diff(settings);
            Assertions.assertTrue(changed.contains("horizonUrl"));
            Assertions.assertTrue(changed.contains("schedules"));
            Assertions.assertFalse(changed.contains("maxAttempts"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void depositSectionIsReadButSeedIsNeverSerialized() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-settings-deposit-");
        try {
            Path file = root.resolve("settings.json");
            Files.writeString(file, """
                    {"deposit": {"distributionSeed": " SSECRETSEED ", "issuerAccount": "GISSUER", "startingBalance": ""}}
                    """, StandardCharsets.UTF_8);
            RuntimeSettings settings = RuntimeSettings.load(file);
            DepositSettings deposit = settings.deposit();
            Assertions.assertEquals("SSECRETSEED", deposit.distributionSeed());
            Assertions.assertEquals("GISSUER", deposit.issuerAccount());
            Assertions.assertEquals("2.01", deposit.startingBalance());
            Assertions.assertEquals(DepositSettings.TESTNET_PASSPHRASE, deposit.networkPassphrase());
            Assertions.assertTrue(deposit.configured());
            Assertions.assertFalse(RuntimeSettings.defaults().deposit().configured());
            Assertions.assertEquals(List.of("deposit"), RuntimeSettings.defaults().diff(settings));

            String json = Jsons.toJson(settings);
            Assertions.assertTrue(json.contains("GISSUER"));
            Assertions.assertFalse(json.contains("SSECRETSEED"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidScheduleOrJsonFailsToLoad() throws Exception {
        Path root = Files.createTempDirectory("ledgerrelay-test-settings-bad-");
        try {
            Path file = root.resolve("settings.json");
            Files.writeString(file, "{\"schedules\":[{\"name\":\"fast\",\"taskType\":\"echo\",\"intervalMs\":10}]}",
                    StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> RuntimeSettings.load(file));

            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> RuntimeSettings.load(file));
        } finally {
            deleteRecursively(root);
        }
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
