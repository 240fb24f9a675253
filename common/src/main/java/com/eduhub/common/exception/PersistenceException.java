package com.eduhub.common.exception;

/**
 * The session store was unreachable or rejected a write outright.
 * No retry happens internally; every write path is idempotent, so the caller
 * can repeat the whole operation with the same input.
 */
public class PersistenceException extends ServiceUnavailableException {

    public static final String ERROR_CODE = "PERSISTENCE_ERROR";

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
