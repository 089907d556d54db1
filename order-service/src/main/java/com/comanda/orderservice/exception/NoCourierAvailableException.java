package com.comanda.orderservice.exception;

import com.comanda.common.exception.EngineException;
import com.comanda.common.exception.ErrorCategory;

import java.util.UUID;

/**
 * Every ranked candidate was full (or there were none). The order stays
 * READY_FOR_PICKUP and dispatch can be retried.
 * HTTP Status: 503 Service Unavailable
 */
public class NoCourierAvailableException extends EngineException {

    public NoCourierAvailableException(UUID orderId, int candidates) {
        super(ErrorCategory.RESOURCE_UNAVAILABLE, "NO_COURIER_AVAILABLE",
                String.format("No courier available for order %s (%d candidates tried)", orderId, candidates));
    }
}
