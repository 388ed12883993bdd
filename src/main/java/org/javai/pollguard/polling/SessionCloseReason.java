package org.javai.pollguard.polling;

/**
 * Why a polling session ended.
 */
public enum SessionCloseReason {
    /** {@link PollingScheduler#stopPolling} or {@link PollingScheduler#stopAll}. */
    STOPPED,
    /** The terminal predicate held for a delivered value. */
    TERMINAL,
    /** The session deadline passed. */
    DEADLINE_EXCEEDED,
    /** A new registration for the same job id took over. */
    REPLACED,
    /** The scheduler was shut down. */
    SHUTDOWN,
    /** The registration's activity classifier or terminal predicate threw. */
    CALLBACK_FAILED
}
