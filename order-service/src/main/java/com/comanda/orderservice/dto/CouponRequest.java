package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.DiscountType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
public class CouponRequest {

    @NotBlank(message = "Coupon code is required")
    @Size(max = 64, message = "Coupon code must be at most 64 characters")
    private String code;

    @NotNull(message = "Discount type is required")
    private DiscountType discountType;

    // fraction in [0, 1] for PERCENTAGE, money amount for FLAT
    @NotNull(message = "Discount value is required")
    @DecimalMin(value = "0.0", message = "Discount value cannot be negative")
    private BigDecimal discountValue;

    @DecimalMin(value = "0.0", message = "Minimum order amount cannot be negative")
    private BigDecimal minOrderAmount = BigDecimal.ZERO;

    @DecimalMin(value = "0.0", message = "Maximum discount cannot be negative")
    private BigDecimal maxDiscountAmount;

    private Instant validFrom;

    @NotNull(message = "Expiry is required")
    private Instant expiresAt;

    @NotNull(message = "Maximum redemptions is required")
    @Min(value = 1, message = "Maximum redemptions must be at least 1")
    private Integer maxRedemptions;

    private UUID restaurantId;

    private Boolean newCustomersOnly = false;
}
