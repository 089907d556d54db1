package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.AssignmentReleaseReason;
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
public class AssignmentResponse {
    private UUID courierId;
    private Instant assignedAt;
    private Instant releasedAt;
    private AssignmentReleaseReason releaseReason;
    private boolean open;
}
