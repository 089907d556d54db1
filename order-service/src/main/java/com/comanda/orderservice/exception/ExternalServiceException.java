package com.comanda.orderservice.exception;

import com.comanda.common.exception.EngineException;
import com.comanda.common.exception.ErrorCategory;

/**
 * Exception thrown when a collaborator (catalog, identity) cannot be reached.
 * The order is left untouched and the call can be retried.
 * HTTP Status: 502 Bad Gateway
 */
public class ExternalServiceException extends EngineException {

    public ExternalServiceException(String message) {
        super(ErrorCategory.DEPENDENCY_FAILURE, "EXTERNAL_SERVICE_ERROR", message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(ErrorCategory.DEPENDENCY_FAILURE, "EXTERNAL_SERVICE_ERROR", message, cause);
    }
}
