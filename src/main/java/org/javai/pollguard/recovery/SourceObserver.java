package org.javai.pollguard.recovery;

import org.javai.pollguard.ClassifiedFailure;

/**
 * Receives what a {@link ValueSource} produces. Errors are not terminal: a source may keep
 * emitting after reporting one. Only {@link #onComplete()} ends it.
 *
 * @param <T> The type of value produced
 */
public interface SourceObserver<T> {

    void onValue(T value);

    void onError(ClassifiedFailure failure);

    void onComplete();
}
