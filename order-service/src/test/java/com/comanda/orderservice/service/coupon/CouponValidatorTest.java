package com.comanda.orderservice.service.coupon;

import com.comanda.orderservice.model.Coupon;
import com.comanda.orderservice.model.DiscountType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CouponValidator Unit Tests")
class CouponValidatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private CouponValidator validator;
    private UUID restaurantId;

    @BeforeEach
    void setUp() {
        validator = new CouponValidator();
        restaurantId = UUID.randomUUID();
    }

    private Coupon.CouponBuilder save10() {
        return Coupon.builder()
                .id(UUID.randomUUID())
                .code("SAVE10")
                .discountType(DiscountType.FLAT)
                .discountValue(new BigDecimal("10.00"))
                .minOrderAmount(new BigDecimal("20.00"))
                .expiresAt(NOW.plus(Duration.ofDays(7)))
                .maxRedemptions(1)
                .redemptionCount(0);
    }

    @Nested
    @DisplayName("accepted coupons")
    class Accepted {

        @Test
        @DisplayName("flat coupon takes its face value off")
        void flatDiscount() {
            CouponValidationResult result = validator.validate("SAVE10", save10().build(),
                    new BigDecimal("50.00"), restaurantId, false, NOW);

            assertThat(result.isApplied()).isTrue();
            assertThat(result.isRejected()).isFalse();
            assertThat(result.getDiscount()).isEqualByComparingTo("10.00");
        }

        @Test
        @DisplayName("percentage coupon is a fraction of the subtotal, rounded half-up")
        void percentageDiscount() {
            Coupon coupon = save10().discountType(DiscountType.PERCENTAGE)
                    .discountValue(new BigDecimal("0.15")).minOrderAmount(BigDecimal.ZERO).build();

            CouponValidationResult result = validator.validate("SAVE10", coupon,
                    new BigDecimal("33.33"), restaurantId, false, NOW);

            // 33.33 * 0.15 = 4.9995
            assertThat(result.getDiscount()).isEqualByComparingTo("5.00");
        }

        @Test
        @DisplayName("percentage discount is capped by maxDiscountAmount")
        void percentageDiscountCapped() {
            Coupon coupon = save10().discountType(DiscountType.PERCENTAGE)
                    .discountValue(new BigDecimal("0.50")).maxDiscountAmount(new BigDecimal("8.00")).build();

            CouponValidationResult result = validator.validate("SAVE10", coupon,
                    new BigDecimal("100.00"), restaurantId, false, NOW);

            assertThat(result.getDiscount()).isEqualByComparingTo("8.00");
        }

        @Test
        @DisplayName("flat discount never exceeds the subtotal")
        void flatDiscountClampedToSubtotal() {
            Coupon coupon = save10().discountValue(new BigDecimal("25.00")).minOrderAmount(BigDecimal.ZERO).build();

            CouponValidationResult result = validator.validate("SAVE10", coupon,
                    new BigDecimal("12.50"), restaurantId, false, NOW);

            assertThat(result.getDiscount()).isEqualByComparingTo("12.50");
        }

        @Test
        @DisplayName("subtotal exactly at the minimum is accepted")
        void subtotalAtMinimum() {
            CouponValidationResult result = validator.validate("SAVE10", save10().build(),
                    new BigDecimal("20.00"), restaurantId, false, NOW);

            assertThat(result.isApplied()).isTrue();
        }

        @Test
        @DisplayName("validating does not consume a redemption")
        void validationIsPure() {
            Coupon coupon = save10().build();

            validator.validate("SAVE10", coupon, new BigDecimal("50.00"), restaurantId, false, NOW);
            validator.validate("SAVE10", coupon, new BigDecimal("50.00"), restaurantId, false, NOW);

            assertThat(coupon.getRedemptionCount()).isZero();
        }
    }

    @Nested
    @DisplayName("rejected coupons")
    class Rejected {

        @Test
        void unknownCode_IsNotFound() {
            CouponValidationResult result = validator.validate("NOPE", null, new BigDecimal("50.00"), restaurantId, false, NOW);

            assertThat(result.getRejection()).isEqualTo(CouponRejection.NOT_FOUND);
            assertThat(result.getCode()).isEqualTo("NOPE");
            assertThat(result.getDiscount()).isEqualByComparingTo("0");
        }

        @Test
        void inactiveCoupon_IsNotFound() {
            CouponValidationResult result = validator.validate("SAVE10", save10().active(false).build(),
                    new BigDecimal("50.00"), restaurantId, false, NOW);

            assertThat(result.getRejection()).isEqualTo(CouponRejection.NOT_FOUND);
        }

        @Test
        void beforeValidFrom_IsNotYetValid() {
            CouponValidationResult result = validator.validate("SAVE10",
                    save10().validFrom(NOW.plusSeconds(60)).build(), new BigDecimal("50.00"), restaurantId, false, NOW);

            assertThat(result.getRejection()).isEqualTo(CouponRejection.NOT_YET_VALID);
        }

        @Test
        void atExpiryInstant_IsExpired() {
            CouponValidationResult result = validator.validate("SAVE10", save10().expiresAt(NOW).build(),
                    new BigDecimal("50.00"), restaurantId, false, NOW);

            assertThat(result.getRejection()).isEqualTo(CouponRejection.EXPIRED);
        }

        @Test
        void allUsesTaken_IsExhausted() {
            CouponValidationResult result = validator.validate("SAVE10", save10().redemptionCount(1).build(),
                    new BigDecimal("50.00"), restaurantId, false, NOW);

            assertThat(result.getRejection()).isEqualTo(CouponRejection.EXHAUSTED);
        }

        @Test
        void otherRestaurant_IsNotApplicable() {
            CouponValidationResult result = validator.validate("SAVE10",
                    save10().restaurantId(UUID.randomUUID()).build(), new BigDecimal("50.00"), restaurantId, false, NOW);

            assertThat(result.getRejection()).isEqualTo(CouponRejection.NOT_APPLICABLE);
        }

        @Test
        void smallSubtotal_IsBelowMinimum() {
            CouponValidationResult result = validator.validate("SAVE10", save10().build(),
                    new BigDecimal("19.99"), restaurantId, false, NOW);

            assertThat(result.getRejection()).isEqualTo(CouponRejection.BELOW_MINIMUM);
            assertThat(result.isApplied()).isFalse();
        }

        @Test
        void welcomeCoupon_CustomerWithEarlierOrder_IsNewCustomersOnly() {
            Coupon coupon = save10().newCustomersOnly(true).build();

            CouponValidationResult result = validator.validate("SAVE10", coupon,
                    new BigDecimal("50.00"), restaurantId, true, NOW);

            assertThat(result.getRejection()).isEqualTo(CouponRejection.NEW_CUSTOMERS_ONLY);
        }

        @Test
        void welcomeCoupon_FirstOrder_IsAccepted() {
            Coupon coupon = save10().newCustomersOnly(true).build();

            CouponValidationResult result = validator.validate("SAVE10", coupon,
                    new BigDecimal("50.00"), restaurantId, false, NOW);

            assertThat(result.isApplied()).isTrue();
        }

        @Test
        @DisplayName("an earlier order does not matter for ordinary coupons")
        void ordinaryCoupon_ReturningCustomer_IsAccepted() {
            CouponValidationResult result = validator.validate("SAVE10", save10().build(),
                    new BigDecimal("50.00"), restaurantId, true, NOW);

            assertThat(result.isApplied()).isTrue();
        }

        @Test
        @DisplayName("expiry is reported before exhaustion and minimum")
        void firstFailingCheckWins() {
            Coupon coupon = save10().expiresAt(NOW.minusSeconds(1)).redemptionCount(1).build();

            CouponValidationResult result = validator.validate("SAVE10", coupon,
                    new BigDecimal("5.00"), restaurantId, false, NOW);

            assertThat(result.getRejection()).isEqualTo(CouponRejection.EXPIRED);
        }
    }
}
