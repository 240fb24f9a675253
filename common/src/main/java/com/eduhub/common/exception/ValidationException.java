package com.eduhub.common.exception;

/**
 * Malformed term, rule, timezone or selection. Always raised before any I/O.
 */
public class ValidationException extends BusinessException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(message, ERROR_CODE);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause, ERROR_CODE);
    }
}
