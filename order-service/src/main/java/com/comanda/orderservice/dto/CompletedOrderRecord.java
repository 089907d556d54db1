package com.comanda.orderservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Delivered order as handed to the demand forecasting service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletedOrderRecord {
    private UUID orderId;
    private UUID customerId;
    private UUID restaurantId;
    private UUID courierId;
    private List<OrderItemResponse> items;
    private BigDecimal total;
    private String couponCode;
    private Instant createdAt;
    private Instant deliveredAt;
}
