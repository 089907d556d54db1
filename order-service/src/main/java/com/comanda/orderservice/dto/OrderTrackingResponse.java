package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

// Courier fields stay null until the order is out for delivery
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderTrackingResponse {
    private UUID orderId;
    private String orderNumber;
    private OrderStatus status;
    private Double pickupLatitude;
    private Double pickupLongitude;
    private UUID courierId;
    private String vehiclePlate;
    private Double courierLatitude;
    private Double courierLongitude;
    private Instant outForDeliveryAt;
    private Instant deliveredAt;
}
