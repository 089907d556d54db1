package com.comanda.orderservice.service.courier;

public enum ReservationResult {
    RESERVED,
    FULL // at capacity, off duty or deactivated
}
