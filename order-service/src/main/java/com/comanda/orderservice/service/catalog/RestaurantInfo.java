package com.comanda.orderservice.service.catalog;

import lombok.Value;

import java.util.UUID;

@Value
public class RestaurantInfo {
    UUID restaurantId;
    UUID ownerId;
    String name;
    Double latitude;
    Double longitude;
    boolean acceptingOrders;
}
