package com.phillippitts.podcaster.exception;

/**
 * Base exception for all podcaster application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class PodcasterException extends RuntimeException {

    public PodcasterException(String message) {
        super(message);
    }

    public PodcasterException(String message, Throwable cause) {
        super(message, cause);
    }

    public PodcasterException(Throwable cause) {
        super(cause);
    }
}
