package org.javai.pollguard.ops;

import java.time.Duration;

import org.javai.pollguard.ClassifiedFailure;
import org.javai.pollguard.breaker.CircuitPhase;
import org.javai.pollguard.polling.SessionCloseReason;
import org.javai.pollguard.recovery.Health;

/**
 * Reports engine events for observability and operator notification.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Implementations are called from engine threads and must not block.
 */
public interface OpReporter {

    /**
     * Reports a classified failure occurrence.
     */
    void report(ClassifiedFailure failure);

    /**
     * Reports that a retry has been scheduled.
     *
     * @param failure The failure that triggered the retry
     * @param attemptNumber The attempt that failed (1-based)
     * @param delay The backoff before the next attempt
     */
    default void reportRetryAttempt(ClassifiedFailure failure, int attemptNumber, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that an operation gave up, either because retries ran out or the failure was not retryable.
     *
     * @param failure The final failure
     * @param totalAttempts The total number of attempts made
     */
    default void reportRetryExhausted(ClassifiedFailure failure, int totalAttempts) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a circuit breaker phase change.
     */
    default void reportCircuitTransition(String key, CircuitPhase from, CircuitPhase to, int consecutiveFailures) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a change of a resilient stream's health state.
     */
    default void reportHealthTransition(String streamId, Health previous, Health current) {
        // Default: no-op. Implementations may override.
    }

    default void reportSessionStarted(String jobId) {
        // Default: no-op. Implementations may override.
    }

    default void reportSessionClosed(String jobId, SessionCloseReason reason) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
