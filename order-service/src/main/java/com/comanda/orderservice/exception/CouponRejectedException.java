package com.comanda.orderservice.exception;

import com.comanda.common.exception.EngineException;
import com.comanda.common.exception.ErrorCategory;
import com.comanda.orderservice.service.coupon.CouponRejection;
import lombok.Getter;

/**
 * The error code is the rejection reason itself (EXPIRED, EXHAUSTED, ...).
 * HTTP Status: 400 Bad Request
 */
@Getter
public class CouponRejectedException extends EngineException {

    private final CouponRejection reason;

    public CouponRejectedException(String code, CouponRejection reason) {
        super(ErrorCategory.VALIDATION, reason.name(),
                String.format("Coupon '%s' rejected: %s", code, reason.getDescription()));
        this.reason = reason;
    }
}
