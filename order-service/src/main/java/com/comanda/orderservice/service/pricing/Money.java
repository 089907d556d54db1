package com.comanda.orderservice.service.pricing;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * All amounts leave the engine with two decimals, rounded half-up.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);

    private Money() {
    }

    public static BigDecimal of(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
