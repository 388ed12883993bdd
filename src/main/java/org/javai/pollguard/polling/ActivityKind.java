package org.javai.pollguard.polling;

/**
 * How a fetched value relates to the previous one. Drives interval adjustment.
 */
public enum ActivityKind {
    STATUS_CHANGED,
    DATA_UPDATED,
    /** The job is waiting on external input; the caller wants to react quickly. */
    WAIT_TRIGGERED,
    NO_CHANGE,
    /** The fetch failed permanently for this tick. */
    ERRORED;

    /**
     * Whether this kind counts as fresh activity that resets the interval to its minimum.
     */
    public boolean isActivity() {
        return this == STATUS_CHANGED || this == DATA_UPDATED || this == WAIT_TRIGGERED;
    }
}
