package com.comanda.orderservice.service.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

// Point-in-time price and validity of one dish
@Value
public class DishInfo {
    UUID dishId;
    UUID restaurantId;
    String name;
    BigDecimal price;
    boolean available;
}
