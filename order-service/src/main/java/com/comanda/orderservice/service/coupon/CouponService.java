package com.comanda.orderservice.service.coupon;

import com.comanda.common.exception.ResourceNotFoundException;
import com.comanda.orderservice.dto.CouponRequest;
import com.comanda.orderservice.dto.CouponResponse;
import com.comanda.orderservice.dto.CouponValidateRequest;
import com.comanda.orderservice.dto.CouponValidationResponse;
import com.comanda.orderservice.exception.CouponRejectedException;
import com.comanda.orderservice.mapper.CouponMapper;
import com.comanda.orderservice.model.Coupon;
import com.comanda.orderservice.model.DiscountType;
import com.comanda.orderservice.repository.CouponRepository;
import com.comanda.orderservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class CouponService {

    private final CouponRepository couponRepository;
    private final OrderRepository orderRepository;
    private final CouponValidator couponValidator;
    private final CouponMapper couponMapper;
    private final Clock clock;

    /**
     * Codes are case-insensitive; blank means no coupon.
     */
    public static String normalizeCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Looks the code up and validates it against the subtotal. Read-only.
     *
     * @param customerId the ordering customer, consulted only for first-order coupons
     */
    public CouponValidationResult evaluate(String rawCode, BigDecimal subtotal, UUID restaurantId, UUID customerId) {
        String code = normalizeCode(rawCode);
        if (code == null) {
            return CouponValidationResult.none();
        }
        Coupon coupon = couponRepository.findByCode(code).orElse(null);
        boolean hasOrdered = coupon != null && Boolean.TRUE.equals(coupon.getNewCustomersOnly())
                && customerId != null && orderRepository.existsByCustomerId(customerId);
        CouponValidationResult result = couponValidator.validate(code, coupon, subtotal, restaurantId,
                hasOrdered, Instant.now(clock));

        if (result.isRejected()) {
            log.info("Coupon rejected: code={}, reason={}, subtotal={}", code, result.getRejection(), subtotal);
        }
        return result;
    }

    /**
     * Consumes one use of an accepted coupon inside the caller's order
     * transaction. A concurrent order may have taken the last use since
     * {@link #evaluate}; that surfaces as EXHAUSTED and rolls the order back.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void redeem(CouponValidationResult result) {
        if (!result.isApplied()) {
            return;
        }
        int updated = couponRepository.redeem(result.getCouponId());
        if (updated == 0) {
            log.info("Coupon exhausted at redemption time: code={}", result.getCode());
            throw new CouponRejectedException(result.getCode(), CouponRejection.EXHAUSTED);
        }
        log.debug("Coupon redeemed: code={}", result.getCode());
    }

    @Transactional
    public CouponResponse createCoupon(CouponRequest request) {
        String code = normalizeCode(request.getCode());
        if (code == null) {
            throw new IllegalArgumentException("Coupon code is required");
        }
        if (couponRepository.existsByCode(code)) {
            throw new IllegalArgumentException("Coupon code already exists: " + code);
        }
        if (request.getDiscountType() == DiscountType.PERCENTAGE
                && request.getDiscountValue().compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Percentage discount must be a fraction between 0 and 1");
        }
        if (request.getValidFrom() != null && !request.getValidFrom().isBefore(request.getExpiresAt())) {
            throw new IllegalArgumentException("Coupon must expire after it becomes valid");
        }

        Coupon coupon = couponMapper.toCoupon(request);
        coupon.setCode(code);
        if (coupon.getMinOrderAmount() == null) {
            coupon.setMinOrderAmount(BigDecimal.ZERO);
        }

        Coupon saved = couponRepository.save(coupon);
        log.info("Coupon created: code={}, type={}, value={}, maxRedemptions={}",
                saved.getCode(), saved.getDiscountType(), saved.getDiscountValue(), saved.getMaxRedemptions());
        return couponMapper.toCouponResponse(saved);
    }

    /**
     * Lets a customer check a code before checking out. Does not reserve a use.
     */
    @Transactional(readOnly = true)
    public CouponValidationResponse preview(CouponValidateRequest request, UUID customerId) {
        CouponValidationResult result = evaluate(request.getCode(), request.getSubtotal(),
                request.getRestaurantId(), customerId);
        return CouponValidationResponse.builder()
                .code(normalizeCode(request.getCode()))
                .valid(result.isApplied())
                .discount(result.getDiscount())
                .reason(result.getRejection())
                .message(result.isRejected() ? result.getRejection().getDescription() : "Coupon applied")
                .build();
    }

    @Transactional(readOnly = true)
    public CouponResponse getCoupon(String code) {
        String normalized = normalizeCode(code);
        Coupon coupon = couponRepository.findByCode(normalized == null ? "" : normalized)
                .orElseThrow(() -> new ResourceNotFoundException("Coupon not found: " + code));
        return couponMapper.toCouponResponse(coupon);
    }
}
