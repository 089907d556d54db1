package com.comanda.orderservice.controller;

import com.comanda.orderservice.dto.CouponRequest;
import com.comanda.orderservice.dto.CouponResponse;
import com.comanda.orderservice.dto.CouponValidateRequest;
import com.comanda.orderservice.dto.CouponValidationResponse;
import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.service.coupon.CouponService;
import com.comanda.orderservice.service.identity.CallerIdentity;
import com.comanda.orderservice.service.identity.IdentityResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/coupons")
@RequiredArgsConstructor
public class CouponController {

    private final CouponService couponService;
    private final IdentityResolver identityResolver;

    @PostMapping
    public ResponseEntity<CouponResponse> createCoupon(
            @Valid @RequestBody CouponRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        identityResolver.resolve(jwt).requireRole(ActorRole.ADMIN);
        return ResponseEntity.status(HttpStatus.CREATED).body(couponService.createCoupon(request));
    }

    // Preview only: a valid answer here does not hold a redemption
    @PostMapping("/validate")
    public ResponseEntity<CouponValidationResponse> validateCoupon(
            @Valid @RequestBody CouponValidateRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt);
        return ResponseEntity.ok(couponService.preview(request, caller.getUserId()));
    }

    @GetMapping("/{code}")
    public ResponseEntity<CouponResponse> getCoupon(
            @PathVariable String code,
            @AuthenticationPrincipal Jwt jwt) {
        identityResolver.resolve(jwt).requireRole(ActorRole.ADMIN);
        return ResponseEntity.ok(couponService.getCoupon(code));
    }
}
