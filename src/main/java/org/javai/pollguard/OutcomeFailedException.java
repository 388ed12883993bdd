package org.javai.pollguard;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * Unchecked because it indicates misuse of the API: the caller should have
 * checked {@link Outcome#isFail()} first.
 */
public class OutcomeFailedException extends RuntimeException {

    private final ClassifiedFailure failure;

    public OutcomeFailedException(ClassifiedFailure failure) {
        super("Outcome failed: " + failure.kind() + ": " + failure.message(), failure.cause());
        this.failure = failure;
    }

    public ClassifiedFailure failure() {
        return failure;
    }
}
