package com.comanda.orderservice.service.pricing;

import com.comanda.orderservice.exception.InvalidItemsException;
import com.comanda.orderservice.service.coupon.CouponValidationResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Computes what an order costs from its snapshotted lines and the coupon
 * outcome. Stateless.
 */
@Component
public class PricingEngine {

    public BigDecimal subtotal(List<PricedItem> items) {
        checkItems(items);
        BigDecimal subtotal = BigDecimal.ZERO;
        for (PricedItem item : items) {
            subtotal = subtotal.add(item.lineTotal());
        }
        return Money.of(subtotal);
    }

    /**
     * The discount is clamped into [0, subtotal] so the total can never go
     * negative and always equals subtotal minus discount.
     */
    public PriceBreakdown price(List<PricedItem> items, CouponValidationResult coupon) {
        BigDecimal subtotal = subtotal(items);

        BigDecimal discount = coupon == null || coupon.getDiscount() == null
                ? BigDecimal.ZERO
                : coupon.getDiscount();
        discount = Money.of(discount.max(BigDecimal.ZERO).min(subtotal));

        return new PriceBreakdown(subtotal, discount, Money.of(subtotal.subtract(discount)));
    }

    private void checkItems(List<PricedItem> items) {
        if (items == null || items.isEmpty()) {
            throw new InvalidItemsException("Order must contain at least one item");
        }
        for (PricedItem item : items) {
            if (item.getQuantity() <= 0) {
                throw new InvalidItemsException(
                        String.format("Quantity for dish %s must be positive, got %d", item.getDishId(), item.getQuantity()));
            }
            if (item.getUnitPrice() == null || item.getUnitPrice().signum() < 0) {
                throw new InvalidItemsException("Dish " + item.getDishId() + " has no valid price");
            }
        }
    }
}
