package com.comanda.orderservice.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourierAssignedEvent {
    private UUID orderId;
    private String orderNumber;
    private UUID courierId;
    private UUID customerId;
    private UUID restaurantId;
    private boolean reassignment;
    private Instant occurredAt;
}
