package com.comanda.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.UUID;

@Entity
@Table(name = "restaurant_snapshots")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class RestaurantSnapshot {

    @Id // Get id from the catalog service
    @ToString.Include
    private UUID restaurantId;

    @Column(name = "owner_id")
    private UUID ownerId;

    @Column(nullable = false)
    private String name;

    private Double latitude;

    private Double longitude;

    @Column(name = "accepting_orders", nullable = false)
    private boolean acceptingOrders;
}
