package com.comanda.common.exception;

/**
 * HTTP Status: 404 Not Found
 */
public class ResourceNotFoundException extends EngineException {

    public ResourceNotFoundException(String message) {
        super(ErrorCategory.NOT_FOUND, "RESOURCE_NOT_FOUND", message);
    }
}
