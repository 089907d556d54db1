package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.model.OrderStatus;
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
public class StatusHistoryResponse {
    private OrderStatus fromStatus;
    private OrderStatus toStatus;
    private ActorRole actorRole;
    private UUID actorId;
    private String note;
    private Instant occurredAt;
}
