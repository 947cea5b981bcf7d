package io.ledgerrelay.config;

import io.ledgerrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record RuntimeSettings(
        String horizonUrl,
        String watchedAccount,
        String watcherId,
        int pageLimit,
        long pollIntervalMs,
        String resyncCursor,
        boolean successfulOnly,
        boolean requireMemo,
        List<String> memoTypes,
        int publishBufferCapacity,
        long connectBaseBackoffMs,
        long connectMaxBackoffMs,
        long httpTimeoutMs,
        int workerPoolSize,
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long taskTimeoutMs,
        int retryDispatchLimit,
        long dispatchIntervalMs,
        long beatTickMs,
        List<ScheduleDefinition> schedules,
        DepositSettings deposit
) {
    public static final String DEFAULT_HORIZON_URL = "https://horizon-testnet.stellar.org";
    public static final int MAX_PAGE_LIMIT = 200;

    public RuntimeSettings {
        memoTypes = memoTypes == null ? List.of() : List.copyOf(memoTypes);
        schedules = schedules == null ? List.of() : List.copyOf(schedules);
        deposit = deposit == null ? DepositSettings.defaults() : deposit;
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(
                DEFAULT_HORIZON_URL,
                "",
                "default",
                MAX_PAGE_LIMIT,
                5_000L,
                "",
                true,
                false,
                List.of(),
                1_000,
                1_000L,
                60_000L,
                20_000L,
                4,
                3,
                1_000L,
                60_000L,
                5L * 60L * 1000L,
                32,
                500L,
                1_000L,
                List.of(new ScheduleDefinition("check_trustlines", "check_trustlines", 60_000L, null)),
                DepositSettings.defaults()
        );
    }

    public static RuntimeSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load runtime settings: " + file, e);
        }
    }

    static RuntimeSettings fromFile(SettingsFile file, RuntimeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        String horizonUrl = sanitizeUrl(file.horizonUrl(), defaults.horizonUrl());
        int pageLimit = Math.min(MAX_PAGE_LIMIT, sanitizeInt(file.pageLimit(), defaults.pageLimit(), 1));
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = Math.max(baseBackoff, sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), 1L));
        long connectBase = sanitizeLong(file.connectBaseBackoffMs(), defaults.connectBaseBackoffMs(), 1L);
        long connectMax = Math.max(connectBase, sanitizeLong(file.connectMaxBackoffMs(), defaults.connectMaxBackoffMs(), 1L));
        return new RuntimeSettings(
                horizonUrl,
                sanitizeText(file.watchedAccount(), defaults.watchedAccount()),
                sanitizeWatcherId(file.watcherId(), defaults.watcherId()),
                pageLimit,
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 100L),
                sanitizeText(file.resyncCursor(), defaults.resyncCursor()),
                file.successfulOnly() == null ? defaults.successfulOnly() : file.successfulOnly(),
                file.requireMemo() == null ? defaults.requireMemo() : file.requireMemo(),
                sanitizeMemoTypes(file.memoTypes(), defaults.memoTypes()),
                sanitizeInt(file.publishBufferCapacity(), defaults.publishBufferCapacity(), 1),
                connectBase,
                connectMax,
                sanitizeLong(file.httpTimeoutMs(), defaults.httpTimeoutMs(), 1_000L),
                sanitizeInt(file.workerPoolSize(), defaults.workerPoolSize(), 1),
                sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1),
                baseBackoff,
                maxBackoff,
                sanitizeLong(file.taskTimeoutMs(), defaults.taskTimeoutMs(), 100L),
                sanitizeInt(file.retryDispatchLimit(), defaults.retryDispatchLimit(), 1),
                sanitizeLong(file.dispatchIntervalMs(), defaults.dispatchIntervalMs(), 10L),
                sanitizeLong(file.beatTickMs(), defaults.beatTickMs(), 100L),
                file.schedules() == null ? defaults.schedules() : file.schedules(),
                DepositSettings.fromFile(file.deposit(), defaults.deposit())
        );
    }

    public List<String> diff(RuntimeSettings other) {
        List<String> fields = new ArrayList<>();
        if (other == null) {
            return fields;
        }
        addIfChanged(fields, "horizonUrl", horizonUrl, other.horizonUrl);
        addIfChanged(fields, "watchedAccount", watchedAccount, other.watchedAccount);
        addIfChanged(fields, "watcherId", watcherId, other.watcherId);
        addIfChanged(fields, "pageLimit", pageLimit, other.pageLimit);
        addIfChanged(fields, "pollIntervalMs", pollIntervalMs, other.pollIntervalMs);
        addIfChanged(fields, "resyncCursor", resyncCursor, other.resyncCursor);
        addIfChanged(fields, "successfulOnly", successfulOnly, other.successfulOnly);
        addIfChanged(fields, "requireMemo", requireMemo, other.requireMemo);
        addIfChanged(fields, "memoTypes", memoTypes, other.memoTypes);
        addIfChanged(fields, "publishBufferCapacity", publishBufferCapacity, other.publishBufferCapacity);
        addIfChanged(fields, "connectBaseBackoffMs", connectBaseBackoffMs, other.connectBaseBackoffMs);
        addIfChanged(fields, "connectMaxBackoffMs", connectMaxBackoffMs, other.connectMaxBackoffMs);
        addIfChanged(fields, "httpTimeoutMs", httpTimeoutMs, other.httpTimeoutMs);
        addIfChanged(fields, "workerPoolSize", workerPoolSize, other.workerPoolSize);
        addIfChanged(fields, "maxAttempts", maxAttempts, other.maxAttempts);
        addIfChanged(fields, "baseBackoffMs", baseBackoffMs, other.baseBackoffMs);
        addIfChanged(fields, "maxBackoffMs", maxBackoffMs, other.maxBackoffMs);
        addIfChanged(fields, "taskTimeoutMs", taskTimeoutMs, other.taskTimeoutMs);
        addIfChanged(fields, "retryDispatchLimit", retryDispatchLimit, other.retryDispatchLimit);
        addIfChanged(fields, "dispatchIntervalMs", dispatchIntervalMs, other.dispatchIntervalMs);
        addIfChanged(fields, "beatTickMs", beatTickMs, other.beatTickMs);
        addIfChanged(fields, "schedules", schedules, other.schedules);
        addIfChanged(fields, "deposit", deposit, other.deposit);
        return fields;
    }

    private static void addIfChanged(List<String> out, String name, Object before, Object after) {
        if (before == null ? after != null : !before.equals(after)) {
            out.add(name);
        }
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw.trim();
    }

    private static String sanitizeUrl(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String url = raw.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    private static String sanitizeWatcherId(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> sanitizeMemoTypes(List<String> raw, List<String> fallback) {
        if (raw == null) {
            return fallback;
        }
        Set<String> out = new LinkedHashSet<>();
        for (String value : raw) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(out);
    }

    public record SettingsFile(
            String horizonUrl,
            String watchedAccount,
            String watcherId,
            Integer pageLimit,
            Long pollIntervalMs,
            String resyncCursor,
            Boolean successfulOnly,
            Boolean requireMemo,
            List<String> memoTypes,
            Integer publishBufferCapacity,
            Long connectBaseBackoffMs,
            Long connectMaxBackoffMs,
            Long httpTimeoutMs,
            Integer workerPoolSize,
            Integer maxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long taskTimeoutMs,
            Integer retryDispatchLimit,
            Long dispatchIntervalMs,
            Long beatTickMs,
            List<ScheduleDefinition> schedules,
            DepositSettings.Section deposit
    ) {
    }
}
