package org.javai.pollguard.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.config.RetryConfig;

/**
 * Exponential backoff with jitter, bounded by a retry count.
 *
 * <p>After attempt {@code n} (1-based) fails, the base delay is
 * {@code min(maxDelay, initialDelay * backoffMultiplier^(n-1))}. Jitter scales it by a random
 * factor in {@code [1 - jitterFactor, 1 + jitterFactor]}. The result is raised to the failure's
 * {@code retryAfter} hint, never drops below the previous delay of the same call and never
 * exceeds {@code maxDelay}.
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double backoffMultiplier;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public static RetryPolicy from(RetryConfig config) {
        return new RetryPolicy(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniformly distributed values in {@code [0, 1)} used for jitter
     */
    public RetryPolicy(RetryConfig config, DoubleSupplier random) {
        Objects.requireNonNull(config, "config must not be null");
        this.maxRetries = config.maxRetries();
        this.initialDelay = config.initialDelay();
        this.maxDelay = config.maxDelay();
        this.backoffMultiplier = config.backoffMultiplier();
        this.jitterFactor = config.jitterFactor();
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Evaluates a failure and decides whether to retry.
     */
    public RetryDecision decide(RetryContext context, ClassifiedFailure failure) {
        if (!failure.retryable()) {
            return RetryDecision.GiveUp.because("failure is not retryable");
        }
        if (context.attemptNumber() > maxRetries) {
            return RetryDecision.GiveUp.because("max retries reached");
        }

        Duration delay = jitter(baseDelay(context.attemptNumber()));

        // Respect the failure's retryAfter hint
        Duration hint = failure.retryAfter();
        if (hint != null && hint.compareTo(delay) > 0) {
            delay = hint;
        }
        if (delay.compareTo(context.previousDelay()) < 0) {
            delay = context.previousDelay();
        }
        if (delay.compareTo(maxDelay) > 0) {
            delay = maxDelay;
        }
        return RetryDecision.Retry.after(delay);
    }

    /**
     * The un-jittered delay after the given failed attempt (1-based).
     */
    public Duration baseDelay(int attemptNumber) {
        double millis = initialDelay.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attemptNumber - 1));
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.round(millis));
    }

    public int maxRetries() {
        return maxRetries;
    }

    private Duration jitter(Duration base) {
        if (jitterFactor == 0.0) {
            return base;
        }
        double factor = 1.0 + jitterFactor * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofMillis(Math.max(0L, Math.round(base.toMillis() * factor)));
    }
}
