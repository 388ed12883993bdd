package org.javai.pollguard.recovery;

/**
 * An open {@link ValueSource}. Closing it stops emissions; {@link #close()} is idempotent.
 */
@FunctionalInterface
public interface SourceHandle extends AutoCloseable {

    @Override
    void close();
}
