package org.javai.pollguard;

/**
 * Classifies failures by where they came from and whether waiting might help.
 */
public enum ErrorKind {
    /**
     * Transport-level trouble: connection refused, DNS failure, connection reset.
     */
    NETWORK(true),

    /**
     * A deadline was exceeded, either for a single fetch or for a whole polling session.
     */
    TIMEOUT(true),

    /**
     * The remote service answered with a 5xx status.
     */
    SERVER_UNAVAILABLE(true),

    /**
     * The remote service refused the request with a 4xx status.
     */
    CLIENT_REJECTED(false),

    /**
     * The remote job reported a failure of its own.
     * Retryability is configurable, see {@link org.javai.pollguard.config.RetryConfig}.
     */
    DOMAIN_FAILURE(false),

    /**
     * The payload was malformed or did not have the expected shape.
     */
    INVALID_DATA(false),

    /**
     * Nothing else matched. Retryability is configurable.
     */
    UNKNOWN(false),

    /**
     * Synthetic failure raised locally when a circuit breaker rejects an attempt.
     * Never produced by an {@link org.javai.pollguard.boundary.ErrorClassifier}.
     */
    CIRCUIT_OPEN(false);

    private final boolean retryableByDefault;

    ErrorKind(boolean retryableByDefault) {
        this.retryableByDefault = retryableByDefault;
    }

    /**
     * Whether failures of this kind are retried when no configuration says otherwise.
     */
    public boolean isRetryableByDefault() {
        return retryableByDefault;
    }
}
