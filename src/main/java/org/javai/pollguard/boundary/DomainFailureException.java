package org.javai.pollguard.boundary;

/**
 * Thrown by a fetch collaborator when the remote job itself reports a failure,
 * as opposed to the transport or the service failing.
 */
public class DomainFailureException extends Exception {

    public DomainFailureException(String message) {
        super(message);
    }

    public DomainFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
