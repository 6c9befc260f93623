package com.coach.linkage.error;

/**
 * Wraps any underlying read or write failure of the record store.
 * The message is meant to be shown to the operator verbatim.
 */
public class StoreException extends LinkageException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
