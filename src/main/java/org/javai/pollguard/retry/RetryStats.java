package org.javai.pollguard.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import org.javai.pollguard.ClassifiedFailure;

/**
 * Snapshot of the retry state for one key.
 *
 * @param key The operation key
 * @param attempt Retries scheduled since the last success or reset; 0 when there is no state
 * @param maxRetries The configured bound for {@code attempt}
 * @param nextDelay The most recently scheduled backoff (zero when there is no state)
 * @param lastFailure The most recent failure
 * @param lastRetryAt When the most recent retry was scheduled
 */
public record RetryStats(
        String key,
        int attempt,
        int maxRetries,
        Duration nextDelay,
        Optional<ClassifiedFailure> lastFailure,
        Optional<Instant> lastRetryAt
) {

    public RetryStats {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(nextDelay, "nextDelay must not be null");
        Objects.requireNonNull(lastFailure, "lastFailure must not be null");
        Objects.requireNonNull(lastRetryAt, "lastRetryAt must not be null");
    }

    public static RetryStats none(String key, int maxRetries) {
        return new RetryStats(key, 0, maxRetries, Duration.ZERO, Optional.empty(), Optional.empty());
    }

    public boolean exhausted() {
        return attempt >= maxRetries;
    }
}
