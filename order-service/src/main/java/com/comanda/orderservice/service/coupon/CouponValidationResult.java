package com.comanda.orderservice.service.coupon;

import com.comanda.orderservice.model.Coupon;
import com.comanda.orderservice.service.pricing.Money;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of {@link CouponValidator#validate}: either a discount for a
 * specific coupon, a rejection reason, or "no coupon requested".
 */
@Getter
@ToString
public final class CouponValidationResult {

    private static final CouponValidationResult NONE = new CouponValidationResult(null, null, Money.ZERO, null);

    private final String code;
    private final UUID couponId;
    private final BigDecimal discount;
    private final CouponRejection rejection;

    private CouponValidationResult(String code, UUID couponId, BigDecimal discount, CouponRejection rejection) {
        this.code = code;
        this.couponId = couponId;
        this.discount = discount;
        this.rejection = rejection;
    }

    public static CouponValidationResult none() {
        return NONE;
    }

    public static CouponValidationResult accepted(Coupon coupon, BigDecimal discount) {
        return new CouponValidationResult(coupon.getCode(), coupon.getId(), discount, null);
    }

    public static CouponValidationResult rejected(String code, CouponRejection reason) {
        return new CouponValidationResult(code, null, Money.ZERO, reason);
    }

    public boolean isApplied() {
        return couponId != null;
    }

    public boolean isRejected() {
        return rejection != null;
    }
}
