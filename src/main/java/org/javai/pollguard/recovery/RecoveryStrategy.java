package org.javai.pollguard.recovery;

/**
 * How a {@link ResilientStream} reacts when its source reports an error.
 */
public enum RecoveryStrategy {
    /**
     * Re-open the source after a backoff delay; after too many attempts escalate to
     * {@link #CIRCUIT_BREAKING}.
     */
    RETRY,

    /**
     * Emit the fallback value (or the last known-good value) and keep observing the source.
     */
    FALLBACK,

    /**
     * Queue values that could not be delivered and replay them in order once the source recovers.
     */
    BUFFER,

    /**
     * Re-open with backoff, but after a run of consecutive errors stop re-opening for a cool-down window.
     */
    CIRCUIT_BREAKING,

    /**
     * Keep going at reduced fidelity: errors are replaced by coarse heartbeats.
     */
    DEGRADED;

    /**
     * The strategy to fall back to once this one has given up.
     */
    public RecoveryStrategy escalation() {
        return this == RETRY ? CIRCUIT_BREAKING : this;
    }
}
