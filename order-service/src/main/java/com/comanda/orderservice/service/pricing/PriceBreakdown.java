package com.comanda.orderservice.service.pricing;

import lombok.Value;

import java.math.BigDecimal;

// total == subtotal - discount, and 0 <= discount <= subtotal
@Value
public class PriceBreakdown {
    BigDecimal subtotal;
    BigDecimal discount;
    BigDecimal total;
}
