package io.agentwarden.queue;

import io.agentwarden.config.WardenSettings;

import java.util.concurrent.ThreadLocalRandom;

public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseBackoffMs < 1 || maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException("backoff bounds are invalid");
        }
    }

    public static RetryPolicy from(WardenSettings settings) {
        return new RetryPolicy(settings.maxAttempts(), settings.baseBackoffMs(), settings.maxBackoffMs());
    }

    /** Doubling delay for the given attempt number (1-based), capped, plus up to 250 ms of jitter. */
    public long backoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, 251L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }
}
