package com.comanda.orderservice.controller;

import com.comanda.orderservice.dto.AssignmentResponse;
import com.comanda.orderservice.dto.CancelOrderRequest;
import com.comanda.orderservice.dto.OrderRequest;
import com.comanda.orderservice.dto.OrderResponse;
import com.comanda.orderservice.dto.OrderTrackingResponse;
import com.comanda.orderservice.dto.StatusHistoryResponse;
import com.comanda.orderservice.dto.TransitionRequest;
import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.model.OrderStatus;
import com.comanda.orderservice.service.identity.CallerIdentity;
import com.comanda.orderservice.service.identity.IdentityResolver;
import com.comanda.orderservice.service.lifecycle.OrderLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderLifecycleService orderLifecycleService;
    private final IdentityResolver identityResolver;

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(
            @Valid @RequestBody OrderRequest orderRequest,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderLifecycleService.createOrder(identityResolver.resolve(jwt), orderRequest);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/my-orders")
    public ResponseEntity<List<OrderResponse>> getMyOrders(
            @RequestParam(required = false) OrderStatus status,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderLifecycleService.getOrdersFor(identityResolver.resolve(jwt), status));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderLifecycleService.getOrder(orderId, identityResolver.resolve(jwt)));
    }

    @GetMapping("/{orderId}/history")
    public ResponseEntity<List<StatusHistoryResponse>> getOrderHistory(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderLifecycleService.getStatusHistory(orderId, identityResolver.resolve(jwt)));
    }

    @GetMapping("/{orderId}/track")
    public ResponseEntity<OrderTrackingResponse> trackOrder(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderLifecycleService.trackOrder(orderId, identityResolver.resolve(jwt)));
    }

    @PostMapping("/{orderId}/transitions")
    public ResponseEntity<OrderResponse> transition(
            @PathVariable UUID orderId,
            @Valid @RequestBody TransitionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderLifecycleService.transition(orderId, request.getTargetStatus(),
                identityResolver.resolve(jwt), request.getExpectedVersion(), request.getNote());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable UUID orderId,
            @Valid @RequestBody(required = false) CancelOrderRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        CancelOrderRequest cancel = request != null ? request : new CancelOrderRequest();
        OrderResponse response = orderLifecycleService.cancel(orderId, identityResolver.resolve(jwt),
                cancel.getReason(), cancel.getExpectedVersion());
        return ResponseEntity.ok(response);
    }

    // Operator tools for orders stuck waiting on a courier
    @PostMapping("/{orderId}/dispatch")
    public ResponseEntity<OrderResponse> dispatchOrder(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        identityResolver.resolve(jwt).requireRole(ActorRole.ADMIN);
        return ResponseEntity.ok(orderLifecycleService.dispatchWithRetry(orderId));
    }

    @GetMapping("/{orderId}/assignments")
    public ResponseEntity<List<AssignmentResponse>> getAssignmentHistory(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        identityResolver.resolve(jwt).requireRole(ActorRole.ADMIN);
        return ResponseEntity.ok(orderLifecycleService.getAssignmentHistory(orderId));
    }

    @PostMapping("/{orderId}/reassign")
    public ResponseEntity<OrderResponse> reassignCourier(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        CallerIdentity caller = identityResolver.resolve(jwt).requireRole(ActorRole.ADMIN);
        return ResponseEntity.ok(orderLifecycleService.reassignCourier(orderId, caller));
    }
}
