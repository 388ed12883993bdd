package org.javai.pollguard.breaker;

/**
 * Phases of a per-key circuit breaker.
 */
public enum CircuitPhase {
    /** Attempts pass through. */
    CLOSED,
    /** Attempts are rejected until the reset timeout has elapsed. */
    OPEN,
    /** A single trial attempt is in flight; its result decides between CLOSED and OPEN. */
    HALF_OPEN
}
