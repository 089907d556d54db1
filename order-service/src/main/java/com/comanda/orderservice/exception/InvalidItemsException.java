package com.comanda.orderservice.exception;

import com.comanda.common.exception.EngineException;
import com.comanda.common.exception.ErrorCategory;

/**
 * HTTP Status: 400 Bad Request
 */
public class InvalidItemsException extends EngineException {

    public InvalidItemsException(String message) {
        super(ErrorCategory.VALIDATION, "INVALID_ITEMS", message);
    }
}
