package org.javai.pollguard.polling;

import java.util.Objects;

/**
 * Compares successive fetched values.
 *
 * @param <T> The type of value being polled
 */
@FunctionalInterface
public interface ActivityClassifier<T> {

    /**
     * @param previous The previously observed value, or null before the first observation
     * @param next The value just fetched
     * @return The activity kind, never null
     */
    ActivityKind classify(T previous, T next);

    /**
     * {@code STATUS_CHANGED} for the first value and whenever the value differs from the
     * previous one by {@link Object#equals}; {@code NO_CHANGE} otherwise.
     */
    static <T> ActivityClassifier<T> byEquality() {
        return (previous, next) -> previous == null || !Objects.equals(previous, next)
                ? ActivityKind.STATUS_CHANGED
                : ActivityKind.NO_CHANGE;
    }
}
