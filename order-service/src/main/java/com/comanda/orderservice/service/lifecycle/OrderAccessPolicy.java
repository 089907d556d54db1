package com.comanda.orderservice.service.lifecycle;

import com.comanda.common.exception.AccessDeniedException;
import com.comanda.common.exception.ResourceNotFoundException;
import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.model.Order;
import com.comanda.orderservice.service.catalog.CatalogClient;
import com.comanda.orderservice.service.catalog.RestaurantInfo;
import com.comanda.orderservice.service.identity.CallerIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Ownership rules on top of the role table: a caller may only see or move
 * orders they are party to. ADMIN and DISPATCH see everything.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderAccessPolicy {

    private final CatalogClient catalogClient;

    public void checkCanView(Order order, CallerIdentity caller) {
        if (!isParty(order, caller)) {
            log.warn("Order view denied: orderId={}, userId={}, role={}", order.getId(), caller.getUserId(), caller.getRole());
            throw new AccessDeniedException("NOT_ORDER_PARTY", "You are not authorized to view this order");
        }
    }

    public void checkCanAct(Order order, CallerIdentity caller) {
        if (!isParty(order, caller)) {
            log.warn("Order action denied: orderId={}, userId={}, role={}", order.getId(), caller.getUserId(), caller.getRole());
            throw new AccessDeniedException("NOT_ORDER_PARTY", "You are not authorized to act on this order");
        }
    }

    /**
     * Narrower than {@link #checkCanView}: restaurants and the dispatcher
     * cannot follow a courier.
     */
    public void checkCanTrack(Order order, CallerIdentity caller) {
        UUID userId = caller.getUserId();
        boolean allowed = caller.getRole() == ActorRole.ADMIN
                || caller.getRole() == ActorRole.CUSTOMER && order.getCustomerId().equals(userId)
                || caller.getRole() == ActorRole.COURIER && userId != null && userId.equals(order.getCourierId());
        if (!allowed) {
            log.warn("Order tracking denied: orderId={}, userId={}, role={}", order.getId(), userId, caller.getRole());
            throw new AccessDeniedException("NOT_ORDER_PARTY", "You are not authorized to track this order");
        }
    }

    boolean isParty(Order order, CallerIdentity caller) {
        if (caller.isPrivileged()) {
            return true;
        }
        UUID userId = caller.getUserId();
        return switch (caller.getRole()) {
            case CUSTOMER -> order.getCustomerId().equals(userId);
            case COURIER -> userId != null && userId.equals(order.getCourierId());
            case RESTAURANT -> ownsRestaurant(order.getRestaurantId(), caller);
            default -> false;
        };
    }

    // The restaurant_id claim wins; without it, fall back to the owner recorded in the catalog
    private boolean ownsRestaurant(UUID restaurantId, CallerIdentity caller) {
        if (caller.getRestaurantId() != null) {
            return caller.getRestaurantId().equals(restaurantId);
        }
        try {
            RestaurantInfo restaurant = catalogClient.getRestaurant(restaurantId);
            return caller.getUserId() != null && caller.getUserId().equals(restaurant.getOwnerId());
        } catch (ResourceNotFoundException e) {
            log.warn("Restaurant {} missing from catalog during ownership check", restaurantId);
            return false;
        }
    }
}
