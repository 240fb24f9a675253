package com.eduhub.common.exception;

/**
 * Thrown when a required dependency is temporarily unavailable.
 * Callers may retry the whole operation later. Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
