package com.comanda.orderservice.model;

public enum CourierStatus {
    ON_DUTY,  // Working; receives orders while under capacity
    OFF_DUTY, // Not working, never receives orders
    ON_BREAK  // Temporarily unavailable, keeps current deliveries
}
