package org.javai.pollguard.retry;

/**
 * Aggregate counters of a {@link RetryExecutor}.
 *
 * @param activeRetryKeys Keys that currently hold retry state
 * @param openCircuits Keys whose breaker is not CLOSED
 * @param totalExecutions Calls to {@code executeWithRetry}
 * @param totalAttempts Operation invocations, retries included
 * @param totalRetries Retries scheduled
 * @param totalSuccesses Calls completed with a value
 * @param totalFailures Calls completed with a failure
 */
public record ExecutorStats(
        int activeRetryKeys,
        int openCircuits,
        long totalExecutions,
        long totalAttempts,
        long totalRetries,
        long totalSuccesses,
        long totalFailures
) {
}
