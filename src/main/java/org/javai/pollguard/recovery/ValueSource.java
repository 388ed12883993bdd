package org.javai.pollguard.recovery;

/**
 * An asynchronous, re-openable producer of values. Each {@link #open} starts an independent
 * run delivering to the given observer until the returned handle is closed.
 *
 * @param <T> The type of value produced
 */
@FunctionalInterface
public interface ValueSource<T> {

    SourceHandle open(SourceObserver<T> observer);
}
