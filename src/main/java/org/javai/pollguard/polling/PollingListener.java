package org.javai.pollguard.polling;

import org.javai.pollguard.ClassifiedFailure;

/**
 * Receives the results of one polling session. Calls for a session never overlap, and none
 * arrive after {@link PollingScheduler#stopPolling} has returned.
 *
 * <p>Exceptions thrown by a listener are logged and reported; they do not stop the session.
 *
 * @param <T> The type of value being polled
 */
public interface PollingListener<T> {

    /**
     * A value was fetched.
     */
    void onValue(T value, ActivityKind activity);

    /**
     * A tick failed after the retry executor gave up, or the session deadline passed.
     */
    default void onError(ClassifiedFailure failure) {
    }

    /**
     * The terminal predicate held for {@code value}; the session closes right after this call.
     */
    default void onTerminal(T value) {
    }

    static <T> PollingListener<T> noOp() {
        return (value, activity) -> {};
    }
}
