package com.comanda.orderservice.exception;

import com.comanda.common.exception.EngineException;
import com.comanda.common.exception.ErrorCategory;
import com.comanda.orderservice.model.OrderStatus;
import lombok.Getter;

/**
 * The order is DELIVERED or CANCELLED and accepts no further transitions.
 * HTTP Status: 422 Unprocessable Entity
 */
@Getter
public class OrderClosedException extends EngineException {

    private final OrderStatus status;

    public OrderClosedException(OrderStatus status, OrderStatus attempted) {
        super(ErrorCategory.STATE_CONFLICT, "ORDER_CLOSED",
                String.format("Order is already %s and cannot move to %s", status, attempted));
        this.status = status;
    }
}
