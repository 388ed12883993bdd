package org.javai.pollguard.breaker;

/**
 * Answer of {@link CircuitBreaker#acquire(String)}.
 */
public enum Admission {
    /** The breaker is open or a trial is already in flight. */
    REJECTED,
    /** The breaker is closed (or disabled). */
    ADMITTED,
    /** The attempt is the single half-open trial; its result decides the next phase. */
    TRIAL;

    public boolean permitted() {
        return this != REJECTED;
    }
}
