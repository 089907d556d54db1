package com.comanda.orderservice.model;

public enum DiscountType {
    PERCENTAGE, // value is a fraction in [0, 1]
    FLAT        // value is an amount of money
}
