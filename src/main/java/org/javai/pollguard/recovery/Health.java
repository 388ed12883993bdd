package org.javai.pollguard.recovery;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import org.javai.pollguard.ClassifiedFailure;

/**
 * The health signal of a {@link ResilientStream}, published on its own channel next to the values.
 *
 * @param state Coarse state
 * @param consecutiveFailures Source errors since the last successful emission
 * @param lastError The most recent source error, if any since the last success
 * @param changedAt When this health value was computed
 */
public record Health(HealthState state, int consecutiveFailures, Optional<ClassifiedFailure> lastError, Instant changedAt) {

    public Health {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(lastError, "lastError must not be null");
        Objects.requireNonNull(changedAt, "changedAt must not be null");
    }

    public static Health healthy(Instant at) {
        return new Health(HealthState.HEALTHY, 0, Optional.empty(), at);
    }

    /**
     * Computes the health after one more consecutive error.
     */
    Health afterError(ClassifiedFailure error, int unhealthyThreshold, Instant at) {
        int failures = consecutiveFailures + 1;
        HealthState next = failures > unhealthyThreshold ? HealthState.UNHEALTHY : HealthState.DEGRADED;
        return new Health(next, failures, Optional.of(error), at);
    }

    /**
     * Whether two health values describe the same condition, ignoring when they were computed.
     */
    public boolean sameAs(Health other) {
        return other != null
                && state == other.state
                && consecutiveFailures == other.consecutiveFailures
                && lastError.equals(other.lastError);
    }

    public boolean isHealthy() {
        return state == HealthState.HEALTHY;
    }
}
