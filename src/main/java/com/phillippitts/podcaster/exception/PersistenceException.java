package com.phillippitts.podcaster.exception;

/**
 * Thrown when the podcast store rejects a read or write.
 */
public class PersistenceException extends PodcasterException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
