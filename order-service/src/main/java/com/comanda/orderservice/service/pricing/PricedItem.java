package com.comanda.orderservice.service.pricing;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One order line with the catalog price already snapshotted.
 */
@Value
public class PricedItem {
    UUID dishId;
    String dishName;
    int quantity;
    BigDecimal unitPrice;

    public BigDecimal lineTotal() {
        return Money.of(unitPrice.multiply(BigDecimal.valueOf(quantity)));
    }
}
