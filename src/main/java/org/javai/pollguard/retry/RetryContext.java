package org.javai.pollguard.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Context provided to a {@link RetryPolicy} for one failed attempt.
 *
 * @param attemptNumber The attempt that just failed (1-based)
 * @param previousDelay The backoff used before this attempt, zero for the first attempt
 */
public record RetryContext(int attemptNumber, Duration previousDelay) {

    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(previousDelay, "previousDelay must not be null");
    }

    public static RetryContext first() {
        return new RetryContext(1, Duration.ZERO);
    }

    public RetryContext next(Duration delayUsed) {
        return new RetryContext(attemptNumber + 1, delayUsed);
    }
}
