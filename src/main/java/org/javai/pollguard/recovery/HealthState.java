package org.javai.pollguard.recovery;

/**
 * Coarse viability of a resilient stream.
 */
public enum HealthState {
    HEALTHY,
    /** At least one error since the last successful emission. */
    DEGRADED,
    /** More consecutive errors than the configured unhealthy threshold. */
    UNHEALTHY
}
