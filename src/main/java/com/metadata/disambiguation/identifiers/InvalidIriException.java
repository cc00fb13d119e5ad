package com.metadata.disambiguation.identifiers;

/**
 * Thrown when a string cannot be parsed into a canonical IRI.
 */
public class InvalidIriException extends Exception {

    public InvalidIriException(String message) {
        super(message);
    }

    public InvalidIriException(String message, Throwable cause) {
        super(message, cause);
    }
}
