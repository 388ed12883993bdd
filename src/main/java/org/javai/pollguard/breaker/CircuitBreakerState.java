package org.javai.pollguard.breaker;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of a circuit breaker key.
 *
 * @param phase Current phase
 * @param consecutiveFailures Failures since the last success
 * @param openedAt When the breaker last opened, present only while OPEN or HALF_OPEN
 */
public record CircuitBreakerState(CircuitPhase phase, int consecutiveFailures, Optional<Instant> openedAt) {

    private static final CircuitBreakerState CLOSED = new CircuitBreakerState(CircuitPhase.CLOSED, 0, Optional.empty());

    public CircuitBreakerState {
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(openedAt, "openedAt must not be null");
    }

    public static CircuitBreakerState closed() {
        return CLOSED;
    }

    public boolean isOpen() {
        return phase == CircuitPhase.OPEN;
    }
}
