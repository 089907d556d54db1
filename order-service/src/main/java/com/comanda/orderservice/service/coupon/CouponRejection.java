package com.comanda.orderservice.service.coupon;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a coupon was not applied. Constants are listed in the order the
 * validator checks them.
 */
@Getter
@RequiredArgsConstructor
public enum CouponRejection {
    NOT_FOUND("coupon does not exist or has been disabled"),
    NOT_YET_VALID("coupon is not valid yet"),
    EXPIRED("coupon has expired"),
    EXHAUSTED("coupon has reached its maximum number of uses"),
    NOT_APPLICABLE("coupon does not apply to this restaurant"),
    BELOW_MINIMUM("order subtotal is below the coupon minimum"),
    NEW_CUSTOMERS_ONLY("coupon is reserved for a customer's first order");

    private final String description;
}
