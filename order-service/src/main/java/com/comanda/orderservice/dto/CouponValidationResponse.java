package com.comanda.orderservice.dto;

import com.comanda.orderservice.service.coupon.CouponRejection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CouponValidationResponse {
    private String code;
    private boolean valid;
    private BigDecimal discount;
    private CouponRejection reason;  // null when valid
    private String message;
}
