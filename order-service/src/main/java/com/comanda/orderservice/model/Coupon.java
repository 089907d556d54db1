package com.comanda.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "coupons")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Coupon {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // always stored upper-case
    @Column(nullable = false, unique = true, length = 64)
    @ToString.Include
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(name = "discount_type", nullable = false, length = 16)
    private DiscountType discountType;

    @Column(name = "discount_value", nullable = false, precision = 12, scale = 4)
    private BigDecimal discountValue;

    @Builder.Default
    @Column(name = "min_order_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal minOrderAmount = BigDecimal.ZERO;

    // Upper bound for percentage coupons; null means uncapped
    @Column(name = "max_discount_amount", precision = 12, scale = 2)
    private BigDecimal maxDiscountAmount;

    @Column(name = "valid_from")
    private Instant validFrom;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "max_redemptions", nullable = false)
    private Integer maxRedemptions;

    // Only ever incremented, by CouponRepository.redeem
    @Builder.Default
    @Column(name = "redemption_count", nullable = false)
    @ToString.Include
    private Integer redemptionCount = 0;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean active = true;

    // When set, the coupon only applies to orders from this restaurant
    @Column(name = "restaurant_id")
    private UUID restaurantId;

    // Welcome coupons: only a customer without any earlier order may use it
    @Builder.Default
    @Column(name = "new_customers_only")
    private Boolean newCustomersOnly = false;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Version
    @Column(name = "version")
    private Long version;
}
