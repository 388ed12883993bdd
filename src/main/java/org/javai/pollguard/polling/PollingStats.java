package org.javai.pollguard.polling;

/**
 * Aggregate counters across every session a scheduler has started.
 */
public record PollingStats(
        long totalSessions,
        int activeSessions,
        long totalAttempts,
        long totalSuccesses,
        long totalErrors
) {

    public double successRate() {
        long completed = totalSuccesses + totalErrors;
        return completed == 0 ? 0.0 : (double) totalSuccesses / completed;
    }

    public double failureRate() {
        long completed = totalSuccesses + totalErrors;
        return completed == 0 ? 0.0 : (double) totalErrors / completed;
    }
}
