package com.metadata.disambiguation.ids;

/**
 * Thrown when an obfuscated id is malformed or does not reference an existing record.
 */
public class InvalidIdException extends Exception {

    public InvalidIdException(String message) {
        super(message);
    }

    public InvalidIdException(String message, Throwable cause) {
        super(message, cause);
    }
}
