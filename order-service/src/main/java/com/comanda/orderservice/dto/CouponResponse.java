package com.comanda.orderservice.dto;

import com.comanda.orderservice.model.DiscountType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CouponResponse {
    private UUID id;
    private String code;
    private DiscountType discountType;
    private BigDecimal discountValue;
    private BigDecimal minOrderAmount;
    private BigDecimal maxDiscountAmount;
    private Instant validFrom;
    private Instant expiresAt;
    private Integer maxRedemptions;
    private Integer redemptionCount;
    private Boolean active;
    private UUID restaurantId;
    private Boolean newCustomersOnly;
}
