package org.javai.pollguard.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.javai.pollguard.ClassifiedFailure;

/**
 * Mutable retry bookkeeping for one key. Guarded by its own monitor.
 */
final class RetryState {

    private final String key;
    private final int maxRetries;
    private int attempt;
    private Duration nextDelay = Duration.ZERO;
    private ClassifiedFailure lastFailure;
    private Instant lastRetryAt;

    RetryState(String key, int maxRetries) {
        this.key = key;
        this.maxRetries = maxRetries;
    }

    synchronized void retryScheduled(int attemptNumber, Duration delay, ClassifiedFailure failure, Instant at) {
        attempt = Math.min(maxRetries, Math.max(attempt, attemptNumber));
        nextDelay = delay;
        lastFailure = failure;
        lastRetryAt = at;
    }

    synchronized void gaveUp(ClassifiedFailure failure) {
        lastFailure = failure;
    }

    synchronized RetryStats snapshot() {
        return new RetryStats(key, attempt, maxRetries, nextDelay,
                Optional.ofNullable(lastFailure), Optional.ofNullable(lastRetryAt));
    }
}
