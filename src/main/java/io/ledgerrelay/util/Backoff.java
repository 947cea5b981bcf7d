package io.ledgerrelay.util;

import java.util.concurrent.ThreadLocalRandom;

public final class Backoff {
    private static final long DEFAULT_JITTER_MS = 250L;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final long jitterMs;

    public Backoff(long baseDelayMs, long maxDelayMs) {
        this(baseDelayMs, maxDelayMs, DEFAULT_JITTER_MS);
    }

    public Backoff(long baseDelayMs, long maxDelayMs, long jitterMs) {
        if (baseDelayMs <= 0L) {
            throw new IllegalArgumentException("baseDelayMs must be positive");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = Math.max(baseDelayMs, maxDelayMs);
        this.jitterMs = Math.max(0L, jitterMs);
    }

    public long delayMs(int attempt) {
        long backoff = baseDelayMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxDelayMs / 2L) {
                backoff = maxDelayMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxDelayMs);
        long jitter = jitterMs == 0L ? 0L : ThreadLocalRandom.current().nextLong(0L, jitterMs + 1L);
        return Math.min(maxDelayMs, backoff + jitter);
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }
}
