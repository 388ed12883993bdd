package org.javai.pollguard.config;

import java.time.Duration;

import static org.javai.pollguard.config.ConfigChecks.*;

/**
 * Retry, backoff and circuit-breaker settings for the retry executor.
 *
 * @param maxRetries Retries after the first attempt; at most {@code maxRetries + 1} invocations
 * @param initialDelay Delay before the first retry
 * @param maxDelay Cap for any single backoff delay
 * @param backoffMultiplier Growth factor between successive delays
 * @param jitterFactor Relative jitter applied to each delay, in {@code [0, 1)}; 0 disables jitter
 * @param fetchTimeout Deadline for a single attempt (null means no deadline)
 * @param failureThreshold Consecutive failures that open the circuit breaker
 * @param resetTimeout Time an open breaker waits before admitting a trial attempt
 * @param circuitBreakerEnabled When false the breaker admits every attempt
 * @param retryDomainFailures Whether {@code DOMAIN_FAILURE} is retryable
 * @param retryUnknownFailures Whether {@code UNKNOWN} is retryable
 */
public record RetryConfig(
        int maxRetries,
        Duration initialDelay,
        Duration maxDelay,
        double backoffMultiplier,
        double jitterFactor,
        Duration fetchTimeout,
        int failureThreshold,
        Duration resetTimeout,
        boolean circuitBreakerEnabled,
        boolean retryDomainFailures,
        boolean retryUnknownFailures
) {

    public RetryConfig {
        atLeast(maxRetries, 0, "maxRetries");
        positive(initialDelay, "initialDelay");
        positive(maxDelay, "maxDelay");
        notShorter(maxDelay, initialDelay, "maxDelay", "initialDelay");
        atLeast(backoffMultiplier, 1.0, "backoffMultiplier");
        if (Double.isNaN(jitterFactor) || jitterFactor < 0.0 || jitterFactor >= 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1), was: " + jitterFactor);
        }
        positiveOrNull(fetchTimeout, "fetchTimeout");
        atLeast(failureThreshold, 1, "failureThreshold");
        positive(resetTimeout, "resetTimeout");
    }

    public static RetryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxRetries(maxRetries)
                .initialDelay(initialDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(backoffMultiplier)
                .jitterFactor(jitterFactor)
                .fetchTimeout(fetchTimeout)
                .failureThreshold(failureThreshold)
                .resetTimeout(resetTimeout)
                .circuitBreakerEnabled(circuitBreakerEnabled)
                .retryDomainFailures(retryDomainFailures)
                .retryUnknownFailures(retryUnknownFailures);
    }

    public static final class Builder {
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.2;
        private Duration fetchTimeout = Duration.ofSeconds(30);
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofMinutes(1);
        private boolean circuitBreakerEnabled = true;
        private boolean retryDomainFailures;
        private boolean retryUnknownFailures;

        private Builder() {
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        /**
         * Sets the per-attempt deadline; null removes it.
         */
        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder resetTimeout(Duration resetTimeout) {
            this.resetTimeout = resetTimeout;
            return this;
        }

        public Builder circuitBreakerEnabled(boolean circuitBreakerEnabled) {
            this.circuitBreakerEnabled = circuitBreakerEnabled;
            return this;
        }

        public Builder retryDomainFailures(boolean retryDomainFailures) {
            this.retryDomainFailures = retryDomainFailures;
            return this;
        }

        public Builder retryUnknownFailures(boolean retryUnknownFailures) {
            this.retryUnknownFailures = retryUnknownFailures;
            return this;
        }

        public RetryConfig build() {
            return new RetryConfig(maxRetries, initialDelay, maxDelay, backoffMultiplier, jitterFactor,
                    fetchTimeout, failureThreshold, resetTimeout, circuitBreakerEnabled,
                    retryDomainFailures, retryUnknownFailures);
        }
    }
}
