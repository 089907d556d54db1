package com.comanda.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Message handed to the notification service after an order transition
 * commits. The routing key carries the event name (order.confirmed,
 * courier.assigned, ...); the body carries everything needed to render it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationContract {
    private UUID recipientId;
    private String event;
    private UUID orderId;
    private String orderNumber;
    private String status;
    private UUID restaurantId;
    private UUID courierId;      // only set once a courier is assigned
    private BigDecimal total;
    private String message;
    private Instant occurredAt;
}
