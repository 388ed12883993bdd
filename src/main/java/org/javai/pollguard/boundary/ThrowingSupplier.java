package org.javai.pollguard.boundary;

/**
 * A supplier that may throw a checked exception.
 * Used by {@link Boundary} and {@link org.javai.pollguard.retry.AsyncOperation#blocking} to wrap
 * calls into transports that signal failures with exceptions.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
