package org.javai.pollguard.boundary;

import java.time.Duration;

/**
 * Thrown by a fetch collaborator when the remote service answered with an unsuccessful status.
 * 5xx codes classify as {@code SERVER_UNAVAILABLE}, 4xx codes as {@code CLIENT_REJECTED}.
 */
public class RemoteStatusException extends Exception {

    private final int statusCode;
    private final Duration retryAfter;

    public RemoteStatusException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    /**
     * @param statusCode The remote status code
     * @param message Description of the response
     * @param retryAfter The remote {@code Retry-After} hint, or null
     */
    public RemoteStatusException(int statusCode, String message, Duration retryAfter) {
        super(message);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public int statusCode() {
        return statusCode;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
