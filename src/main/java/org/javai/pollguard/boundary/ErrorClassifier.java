package org.javai.pollguard.boundary;

import org.javai.pollguard.ClassifiedFailure;

/**
 * Classifies raw failures into {@link ClassifiedFailure} values.
 * Implementations must be total: every input, including null, yields a failure and nothing is thrown.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies a raw failure.
     *
     * @param operation The operation key the failure belongs to
     * @param throwable The failure that occurred (may be null)
     * @return A classified failure, never null
     */
    ClassifiedFailure classify(String operation, Throwable throwable);
}
