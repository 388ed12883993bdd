package org.javai.pollguard.boundary;

/**
 * Thrown by a fetch collaborator when a response could not be turned into a value.
 */
public class InvalidDataException extends Exception {

    public InvalidDataException(String message) {
        super(message);
    }

    public InvalidDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
