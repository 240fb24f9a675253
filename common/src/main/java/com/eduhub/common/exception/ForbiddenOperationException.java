package com.eduhub.common.exception;

/**
 * A destructive capability was requested outside the environment that permits it,
 * or a production run was attempted without explicit confirmation.
 * Mapped to HTTP 403.
 */
public class ForbiddenOperationException extends BusinessException {

    public static final String ERROR_CODE = "FORBIDDEN_OPERATION";

    public ForbiddenOperationException(String message) {
        super(message, ERROR_CODE);
    }
}
