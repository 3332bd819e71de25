package io.relaywatch.queue;

import io.relaywatch.config.WatchSettings;

/**
 * @param maxAttempts     deliveries allowed to fail with an exception before the job is FAILED
 * @param maxStalledCount lock expiries tolerated before the job is FAILED instead of redelivered
 */
public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs, int maxStalledCount) {
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final int DEFAULT_MAX_STALLED = 1;

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseBackoffMs = Math.max(0L, baseBackoffMs);
        maxBackoffMs = Math.max(baseBackoffMs, maxBackoffMs);
        maxStalledCount = Math.max(0, maxStalledCount);
    }

    public static RetryPolicy from(WatchSettings settings) {
        return new RetryPolicy(settings.workerMaxAttempts(), DEFAULT_BASE_BACKOFF_MS, DEFAULT_MAX_BACKOFF_MS, DEFAULT_MAX_STALLED);
    }
}
