package com.comanda.orderservice.controller;

import com.comanda.orderservice.config.DispatchProperties;
import com.comanda.orderservice.dto.CompletedOrderRecord;
import com.comanda.orderservice.dto.OrderResponse;
import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.service.identity.IdentityResolver;
import com.comanda.orderservice.service.lifecycle.OrderLifecycleService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Service-to-service and operator reads. Callers need the ADMIN client role
 * (service accounts are granted it).
 */
@RestController
@RequestMapping("/api/v1/internal/orders")
@RequiredArgsConstructor
public class OrderInternalController {

    private final OrderLifecycleService orderLifecycleService;
    private final IdentityResolver identityResolver;
    private final DispatchProperties dispatchProperties;

    // Feed for demand forecasting
    @GetMapping("/completed")
    public ResponseEntity<List<CompletedOrderRecord>> getCompletedOrders(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @AuthenticationPrincipal Jwt jwt) {
        identityResolver.resolve(jwt).requireRole(ActorRole.ADMIN);
        return ResponseEntity.ok(orderLifecycleService.getCompletedOrders(since));
    }

    /**
     * READY_FOR_PICKUP orders still without a courier. With {@code stuck=true}
     * only those waiting longer than the configured stuck threshold.
     */
    @GetMapping("/awaiting-dispatch")
    public ResponseEntity<List<OrderResponse>> getOrdersAwaitingDispatch(
            @RequestParam(defaultValue = "false") boolean stuck,
            @AuthenticationPrincipal Jwt jwt) {
        identityResolver.resolve(jwt).requireRole(ActorRole.ADMIN);
        Duration olderThan = stuck ? dispatchProperties.getStuckThreshold() : Duration.ZERO;
        return ResponseEntity.ok(orderLifecycleService.findOrdersAwaitingDispatch(olderThan));
    }
}
