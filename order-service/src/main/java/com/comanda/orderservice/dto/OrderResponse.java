package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.model.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {
    private UUID id;
    private String orderNumber;
    private UUID customerId;
    private UUID restaurantId;
    private UUID courierId;
    private List<OrderItemResponse> items;
    private BigDecimal subtotal;
    private BigDecimal discount;
    private BigDecimal total;
    private String couponCode;
    private OrderStatus status;
    private String deliveryNote;
    private String cancellationReason;
    private ActorRole cancelledBy;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant confirmedAt;
    private Instant preparingAt;
    private Instant readyAt;
    private Instant outForDeliveryAt;
    private Instant deliveredAt;
    private Instant cancelledAt;
    // send back as expectedVersion to guard the next transition
    private Long version;
}
