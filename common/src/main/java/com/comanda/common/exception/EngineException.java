package com.comanda.common.exception;

import lombok.Getter;

/**
 * Base class for typed failures raised by the order engine.
 * Carries a taxonomy category and a precise error code so the caller can
 * tell an exhausted coupon from an expired one without parsing messages.
 */
@Getter
public abstract class EngineException extends RuntimeException {

    private final ErrorCategory category;
    private final String errorCode;

    protected EngineException(ErrorCategory category, String errorCode, String message) {
        super(message);
        this.category = category;
        this.errorCode = errorCode;
    }

    protected EngineException(ErrorCategory category, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.errorCode = errorCode;
    }

    /**
     * Whether repeating the same call later may succeed without the caller
     * changing anything.
     */
    public boolean isRetryable() {
        return category == ErrorCategory.CONCURRENCY_CONFLICT
                || category == ErrorCategory.RESOURCE_UNAVAILABLE
                || category == ErrorCategory.DEPENDENCY_FAILURE;
    }
}
