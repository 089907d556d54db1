package com.comanda.orderservice.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "orders")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    // ORD-yyyyMMdd-XXXXXX, shown to customers and support
    @Column(name = "order_number", nullable = false, unique = true, updatable = false)
    @ToString.Include
    private String orderNumber;

    @Column(name = "customer_id", nullable = false)
    private UUID customerId;

    @Column(name = "restaurant_id", nullable = false)
    private UUID restaurantId;

    // Set together with OUT_FOR_DELIVERY, kept on DELIVERED, cleared on CANCELLED
    @Setter(AccessLevel.NONE)
    @Column(name = "courier_id")
    private UUID courierId;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<OrderItem> items = new ArrayList<>();

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal discount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal total;

    @Column(name = "coupon_code")
    private String couponCode;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @ToString.Include
    private OrderStatus status = OrderStatus.PENDING;

    // Pickup point snapshot of the restaurant at order time, used for courier ranking
    @Column(name = "pickup_latitude")
    private Double pickupLatitude;

    @Column(name = "pickup_longitude")
    private Double pickupLongitude;

    @Column(name = "delivery_note", length = 500)
    private String deliveryNote;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by", length = 32)
    private ActorRole cancelledBy;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "preparing_at")
    private Instant preparingAt;

    @Column(name = "ready_at")
    private Instant readyAt;

    @Column(name = "out_for_delivery_at")
    private Instant outForDeliveryAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    // Optimistic locking: the versioned UPDATE is the compare-and-set of every transition
    @Version
    @Column(name = "version")
    private Long version;

    public void addItem(OrderItem item) {
        item.setOrder(this);
        items.add(item);
    }

    /**
     * Moves the order to {@code target} and stamps the matching timestamp.
     * Only {@code OrderStateMachine} calls this; the table check happens there.
     */
    public void moveTo(OrderStatus target, Instant at) {
        this.status = target;
        switch (target) {
            case CONFIRMED -> confirmedAt = at;
            case PREPARING -> preparingAt = at;
            case READY_FOR_PICKUP -> readyAt = at;
            case OUT_FOR_DELIVERY -> outForDeliveryAt = at;
            case DELIVERED -> deliveredAt = at;
            case CANCELLED -> cancelledAt = at;
            default -> {
            }
        }
    }

    public void assignCourier(UUID courierId) {
        this.courierId = courierId;
    }

    public void clearCourier() {
        this.courierId = null;
    }
}
