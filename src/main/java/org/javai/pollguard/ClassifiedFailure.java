package org.javai.pollguard;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A raw failure after classification. This is the only failure shape handed to consumers:
 * the underlying exception travels along as {@link #cause()} but is never rethrown.
 *
 * @param kind The failure classification
 * @param retryable Whether the retry executor may try again
 * @param statusCode The remote status code, if the failure came from a remote response
 * @param occurredAt When the failure happened
 * @param cause The underlying exception (may be null, e.g. for circuit-open rejections)
 * @param message Human-readable description
 * @param operation The operation key the failure belongs to (job id or operation name)
 * @param retryAfter Remote hint for the minimum wait before retrying (may be null)
 */
public record ClassifiedFailure(
        ErrorKind kind,
        boolean retryable,
        OptionalInt statusCode,
        Instant occurredAt,
        Throwable cause,
        String message,
        String operation,
        Duration retryAfter
) {

    public ClassifiedFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(statusCode, "statusCode must not be null, use OptionalInt.empty()");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        if (retryAfter != null && retryAfter.isNegative()) {
            retryAfter = Duration.ZERO;
        }
    }

    /**
     * Creates the synthetic failure used when a circuit breaker rejects an attempt.
     *
     * @param operation the key whose breaker is open
     * @param occurredAt when the rejection happened
     * @param retryAfter time until the breaker admits a trial attempt
     */
    public static ClassifiedFailure circuitOpen(String operation, Instant occurredAt, Duration retryAfter) {
        return new ClassifiedFailure(ErrorKind.CIRCUIT_OPEN, false, OptionalInt.empty(), occurredAt, null,
                "Circuit breaker is open for [" + operation + "]", operation, retryAfter);
    }

    /**
     * Creates a builder for constructing failures with full context.
     */
    public static Builder builder(ErrorKind kind, String message, String operation) {
        return new Builder(kind, message, operation);
    }

    /**
     * Returns a copy bound to a different operation key.
     */
    public ClassifiedFailure withOperation(String operation) {
        return new ClassifiedFailure(kind, retryable, statusCode, occurredAt, cause, message, operation, retryAfter);
    }

    /**
     * Returns a {@link Cause} describing the underlying exception, or null when there is none.
     */
    public Cause diagnosticCause() {
        return cause == null ? null : Cause.fromThrowable(cause);
    }

    public static class Builder {
        private final ErrorKind kind;
        private final String message;
        private final String operation;
        private boolean retryable;
        private OptionalInt statusCode = OptionalInt.empty();
        private Instant occurredAt = Instant.now();
        private Throwable cause;
        private Duration retryAfter;

        private Builder(ErrorKind kind, String message, String operation) {
            this.kind = Objects.requireNonNull(kind);
            this.message = Objects.requireNonNull(message);
            this.operation = Objects.requireNonNull(operation);
            this.retryable = kind.isRetryableByDefault();
        }

        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder statusCode(int statusCode) {
            this.statusCode = OptionalInt.of(statusCode);
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public Builder retryAfter(Duration retryAfter) {
            this.retryAfter = retryAfter;
            return this;
        }

        public ClassifiedFailure build() {
            return new ClassifiedFailure(kind, retryable, statusCode, occurredAt, cause, message, operation, retryAfter);
        }
    }
}
