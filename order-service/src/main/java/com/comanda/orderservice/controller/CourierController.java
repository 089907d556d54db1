package com.comanda.orderservice.controller;

import com.comanda.orderservice.dto.CourierResponse;
import com.comanda.orderservice.dto.RegisterCourierRequest;
import com.comanda.orderservice.dto.UpdateCourierLocationRequest;
import com.comanda.orderservice.dto.UpdateCourierStatusRequest;
import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.service.courier.CourierDirectory;
import com.comanda.orderservice.service.identity.IdentityResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/couriers")
@RequiredArgsConstructor
@Slf4j
public class CourierController {

    private final CourierDirectory courierDirectory;
    private final IdentityResolver identityResolver;

    /**
     * Returns the calling courier's profile, creating it on first call.
     */
    @GetMapping("/me")
    public ResponseEntity<CourierResponse> getMyProfile(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(courierDirectory.getOrRegister(courierId(jwt)));
    }

    @PutMapping("/me")
    public ResponseEntity<CourierResponse> registerProfile(
            @Valid @RequestBody RegisterCourierRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(courierDirectory.register(courierId(jwt), request));
    }

    @PatchMapping("/me/status")
    public ResponseEntity<CourierResponse> updateMyStatus(
            @Valid @RequestBody UpdateCourierStatusRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        UUID courierId = courierId(jwt);
        log.info("Updating status for courier {} to {}", courierId, request.getStatus());
        return ResponseEntity.ok(courierDirectory.setAvailability(courierId, request.getStatus()));
    }

    @PatchMapping("/me/location")
    public ResponseEntity<CourierResponse> updateMyLocation(
            @Valid @RequestBody UpdateCourierLocationRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(courierDirectory.updateLocation(courierId(jwt),
                request.getLatitude(), request.getLongitude()));
    }

    @GetMapping
    public ResponseEntity<List<CourierResponse>> listCouriers(@AuthenticationPrincipal Jwt jwt) {
        identityResolver.resolve(jwt).requireRole(ActorRole.ADMIN);
        return ResponseEntity.ok(courierDirectory.listCouriers());
    }

    @PatchMapping("/{courierId}/active")
    public ResponseEntity<CourierResponse> setActive(
            @PathVariable UUID courierId,
            @RequestParam boolean active,
            @AuthenticationPrincipal Jwt jwt) {
        identityResolver.resolve(jwt).requireRole(ActorRole.ADMIN);
        return ResponseEntity.ok(courierDirectory.setActive(courierId, active));
    }

    private UUID courierId(Jwt jwt) {
        return identityResolver.resolve(jwt).requireRole(ActorRole.COURIER).getUserId();
    }
}
