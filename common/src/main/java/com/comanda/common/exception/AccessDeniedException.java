package com.comanda.common.exception;

/**
 * Exception thrown when a caller's role or ownership does not allow the action.
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends EngineException {

    public AccessDeniedException(String message) {
        super(ErrorCategory.AUTHORIZATION, "ACCESS_DENIED", message);
    }

    public AccessDeniedException(String errorCode, String message) {
        super(ErrorCategory.AUTHORIZATION, errorCode, message);
    }
}
