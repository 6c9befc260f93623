package com.coach.linkage.error;

/**
 * Thrown when a record is missing required data (e.g. an empty first or last name)
 * and is rejected before any match or write is attempted.
 */
public class ValidationException extends LinkageException {

    public ValidationException(String message) {
        super(message);
    }
}
