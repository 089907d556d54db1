package com.comanda.orderservice.service.coupon;

import com.comanda.orderservice.model.Coupon;
import com.comanda.orderservice.service.pricing.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Decides whether a coupon applies to an order and how much it takes off.
 * Pure: reads the coupon as given and never touches the redemption count,
 * so validating the same order twice cannot double-count a use.
 */
@Component
public class CouponValidator {

    /**
     * Checks run in a fixed order and the first failure wins: existence
     * (inactive counts as missing), start date, expiry, remaining uses,
     * restaurant restriction, minimum subtotal, first-order restriction.
     *
     * @param code         the code as the customer typed it, echoed back on rejection
     * @param coupon       the stored coupon, or null when the code is unknown
     * @param subtotal     order subtotal before discount
     * @param restaurantId restaurant the order is placed with
     * @param hasOrdered   whether the customer has placed an order before
     * @param now          evaluation instant
     */
    public CouponValidationResult validate(String code, Coupon coupon, BigDecimal subtotal,
            UUID restaurantId, boolean hasOrdered, Instant now) {
        if (coupon == null || !Boolean.TRUE.equals(coupon.getActive())) {
            return CouponValidationResult.rejected(code, CouponRejection.NOT_FOUND);
        }
        if (coupon.getValidFrom() != null && now.isBefore(coupon.getValidFrom())) {
            return CouponValidationResult.rejected(code, CouponRejection.NOT_YET_VALID);
        }
        if (!now.isBefore(coupon.getExpiresAt())) {
            return CouponValidationResult.rejected(code, CouponRejection.EXPIRED);
        }
        if (coupon.getRedemptionCount() >= coupon.getMaxRedemptions()) {
            return CouponValidationResult.rejected(code, CouponRejection.EXHAUSTED);
        }
        if (coupon.getRestaurantId() != null && !coupon.getRestaurantId().equals(restaurantId)) {
            return CouponValidationResult.rejected(code, CouponRejection.NOT_APPLICABLE);
        }
        if (subtotal.compareTo(coupon.getMinOrderAmount()) < 0) {
            return CouponValidationResult.rejected(code, CouponRejection.BELOW_MINIMUM);
        }
        if (Boolean.TRUE.equals(coupon.getNewCustomersOnly()) && hasOrdered) {
            return CouponValidationResult.rejected(code, CouponRejection.NEW_CUSTOMERS_ONLY);
        }
        return CouponValidationResult.accepted(coupon, discountFor(coupon, subtotal));
    }

    BigDecimal discountFor(Coupon coupon, BigDecimal subtotal) {
        BigDecimal discount = switch (coupon.getDiscountType()) {
            case FLAT -> coupon.getDiscountValue().min(subtotal);
            case PERCENTAGE -> subtotal.multiply(coupon.getDiscountValue());
        };
        if (coupon.getMaxDiscountAmount() != null) {
            discount = discount.min(coupon.getMaxDiscountAmount());
        }
        return Money.of(discount.max(BigDecimal.ZERO));
    }
}
