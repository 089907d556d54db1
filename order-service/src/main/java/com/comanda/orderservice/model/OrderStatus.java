package com.comanda.orderservice.model;

public enum OrderStatus {
    PENDING,          // placed by the customer, waiting for the restaurant
    CONFIRMED,        // accepted by the restaurant
    PREPARING,
    READY_FOR_PICKUP, // food is ready, waiting for a courier
    OUT_FOR_DELIVERY, // courier reserved and on the way
    DELIVERED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }
}
