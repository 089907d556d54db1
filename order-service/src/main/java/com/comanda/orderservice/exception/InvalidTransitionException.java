package com.comanda.orderservice.exception;

import com.comanda.common.exception.EngineException;
import com.comanda.common.exception.ErrorCategory;
import com.comanda.orderservice.model.OrderStatus;
import lombok.Getter;

/**
 * The requested edge does not exist in the transition table for any role.
 * HTTP Status: 422 Unprocessable Entity
 */
@Getter
public class InvalidTransitionException extends EngineException {

    private final OrderStatus from;
    private final OrderStatus to;

    public InvalidTransitionException(OrderStatus from, OrderStatus to) {
        super(ErrorCategory.STATE_CONFLICT, "INVALID_TRANSITION",
                String.format("Order cannot move from %s to %s", from, to));
        this.from = from;
        this.to = to;
    }
}
