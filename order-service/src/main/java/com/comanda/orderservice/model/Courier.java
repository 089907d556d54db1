package com.comanda.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "couriers")
@DynamicUpdate // profile edits must not rewrite active_order_count
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Courier {

    @Id // This IS the identity provider subject ('sub' claim)
    @ToString.Include
    private UUID id;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @ToString.Include
    private CourierStatus status = CourierStatus.OFF_DUTY;

    @Column(name = "vehicle_plate")
    private String vehiclePlate;

    @Column(name = "phone_number")
    private String phoneNumber;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @Column(name = "current_latitude")
    private Double currentLatitude;

    @Column(name = "current_longitude")
    private Double currentLongitude;

    // Changed only through CourierRepository.reserve/release
    @Builder.Default
    @Column(name = "active_order_count", nullable = false)
    @ToString.Include
    private Integer activeOrderCount = 0;

    @Column(nullable = false)
    private Integer capacity;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // Bumped by reserve/release too, so a stale profile save fails instead of
    // overwriting a reservation
    @Version
    @Column(name = "version")
    private Long version;

    public boolean isAvailable() {
        return Boolean.TRUE.equals(isActive)
                && status == CourierStatus.ON_DUTY
                && activeOrderCount < capacity;
    }
}
