package com.comanda.orderservice.exception;

import com.comanda.common.exception.EngineException;
import com.comanda.common.exception.ErrorCategory;

/**
 * Another request changed the order between our read and our write.
 * HTTP Status: 409 Conflict
 */
public class ConcurrencyConflictException extends EngineException {

    public ConcurrencyConflictException(String message) {
        super(ErrorCategory.CONCURRENCY_CONFLICT, "CONCURRENT_MODIFICATION", message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(ErrorCategory.CONCURRENCY_CONFLICT, "CONCURRENT_MODIFICATION", message, cause);
    }
}
