package com.comanda.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * One order carried by one courier. Open while {@code releasedAt} is null;
 * released rows stay as delivery history.
 */
@Entity
@Table(name = "courier_assignments", indexes = {
        @Index(name = "idx_assignment_order", columnList = "order_id"),
        @Index(name = "idx_assignment_courier", columnList = "courier_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourierAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private UUID orderId;

    @Column(name = "courier_id", nullable = false, updatable = false)
    private UUID courierId;

    @Column(name = "assigned_at", nullable = false, updatable = false)
    private Instant assignedAt;

    @Column(name = "released_at")
    private Instant releasedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "release_reason", length = 16)
    private AssignmentReleaseReason releaseReason;

    public boolean isOpen() {
        return releasedAt == null;
    }
}
