package org.javai.pollguard.config;

import java.time.Duration;

import static org.javai.pollguard.config.ConfigChecks.*;

/**
 * Cadence settings for the polling scheduler.
 *
 * @param minInterval Interval used right after fresh activity, and for the first poll
 * @param maxInterval Upper bound the interval may grow to
 * @param inactivityThreshold Number of unchanged polls tolerated before the interval starts growing
 * @param growthFactor Multiplier applied to the interval each time it grows
 * @param sessionTimeout Overall deadline for a polling session (null means no deadline)
 */
public record PollingConfig(
        Duration minInterval,
        Duration maxInterval,
        int inactivityThreshold,
        double growthFactor,
        Duration sessionTimeout
) {

    public PollingConfig {
        positive(minInterval, "minInterval");
        positive(maxInterval, "maxInterval");
        notShorter(maxInterval, minInterval, "maxInterval", "minInterval");
        atLeast(inactivityThreshold, 0, "inactivityThreshold");
        atLeast(growthFactor, 1.0, "growthFactor");
        positiveOrNull(sessionTimeout, "sessionTimeout");
    }

    public static PollingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .minInterval(minInterval)
                .maxInterval(maxInterval)
                .inactivityThreshold(inactivityThreshold)
                .growthFactor(growthFactor)
                .sessionTimeout(sessionTimeout);
    }

    public static final class Builder {
        private Duration minInterval = Duration.ofSeconds(1);
        private Duration maxInterval = Duration.ofMinutes(5);
        private int inactivityThreshold = 3;
        private double growthFactor = 1.5;
        private Duration sessionTimeout;

        private Builder() {
        }

        public Builder minInterval(Duration minInterval) {
            this.minInterval = minInterval;
            return this;
        }

        public Builder maxInterval(Duration maxInterval) {
            this.maxInterval = maxInterval;
            return this;
        }

        public Builder inactivityThreshold(int inactivityThreshold) {
            this.inactivityThreshold = inactivityThreshold;
            return this;
        }

        public Builder growthFactor(double growthFactor) {
            this.growthFactor = growthFactor;
            return this;
        }

        public Builder sessionTimeout(Duration sessionTimeout) {
            this.sessionTimeout = sessionTimeout;
            return this;
        }

        public PollingConfig build() {
            return new PollingConfig(minInterval, maxInterval, inactivityThreshold, growthFactor, sessionTimeout);
        }
    }
}
