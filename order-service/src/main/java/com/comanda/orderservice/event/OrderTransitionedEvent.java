package com.comanda.orderservice.event;

import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.model.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Domain event published inside the transition's transaction and handled by
 * a @TransactionalEventListener once that transaction has committed.
 * {@code fromStatus} is null for a newly placed order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderTransitionedEvent {
    private UUID orderId;
    private String orderNumber;
    private UUID customerId;
    private UUID restaurantId;
    private UUID restaurantOwnerId; // only known when the order is placed
    private UUID courierId;
    private OrderStatus fromStatus;
    private OrderStatus toStatus;
    private ActorRole actorRole;
    private BigDecimal total;
    private Instant occurredAt;
}
