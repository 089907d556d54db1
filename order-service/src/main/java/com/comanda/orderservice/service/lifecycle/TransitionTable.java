package com.comanda.orderservice.service.lifecycle;

import com.comanda.common.exception.AccessDeniedException;
import com.comanda.orderservice.exception.InvalidTransitionException;
import com.comanda.orderservice.exception.OrderClosedException;
import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.model.OrderStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Which role may move an order from which state to which state.
 * New behaviour is added as rows here, not as code paths.
 */
public final class TransitionTable {

    private static final Map<OrderStatus, Map<ActorRole, Set<OrderStatus>>> TABLE = new EnumMap<>(OrderStatus.class);

    static {
        allow(OrderStatus.PENDING, ActorRole.RESTAURANT, OrderStatus.CONFIRMED, OrderStatus.CANCELLED);
        allow(OrderStatus.PENDING, ActorRole.CUSTOMER, OrderStatus.CANCELLED);
        allow(OrderStatus.CONFIRMED, ActorRole.RESTAURANT, OrderStatus.PREPARING, OrderStatus.CANCELLED);
        allow(OrderStatus.PREPARING, ActorRole.RESTAURANT, OrderStatus.READY_FOR_PICKUP);
        allow(OrderStatus.READY_FOR_PICKUP, ActorRole.DISPATCH, OrderStatus.OUT_FOR_DELIVERY);
        allow(OrderStatus.OUT_FOR_DELIVERY, ActorRole.COURIER, OrderStatus.DELIVERED);

        for (OrderStatus status : OrderStatus.values()) {
            if (!status.isTerminal()) {
                allow(status, ActorRole.ADMIN, OrderStatus.CANCELLED);
            }
        }
    }

    private TransitionTable() {
    }

    private static void allow(OrderStatus from, ActorRole role, OrderStatus... targets) {
        TABLE.computeIfAbsent(from, key -> new EnumMap<>(ActorRole.class))
                .computeIfAbsent(role, key -> EnumSet.noneOf(OrderStatus.class))
                .addAll(Set.of(targets));
    }

    public static Set<OrderStatus> allowedTargets(OrderStatus from, ActorRole role) {
        return Collections.unmodifiableSet(
                TABLE.getOrDefault(from, Map.of()).getOrDefault(role, EnumSet.noneOf(OrderStatus.class)));
    }

    /**
     * True if any role may take the edge.
     */
    public static boolean isEdge(OrderStatus from, OrderStatus to) {
        return TABLE.getOrDefault(from, Map.of()).values().stream().anyMatch(targets -> targets.contains(to));
    }

    /**
     * Rejects the move unless the table lists it for {@code role}.
     *
     * @throws OrderClosedException        the order is in a terminal state
     * @throws InvalidTransitionException  no role may take this edge
     * @throws AccessDeniedException       the edge exists but not for this role
     */
    public static void check(OrderStatus from, OrderStatus to, ActorRole role) {
        if (from.isTerminal()) {
            throw new OrderClosedException(from, to);
        }
        if (allowedTargets(from, role).contains(to)) {
            return;
        }
        if (!isEdge(from, to)) {
            throw new InvalidTransitionException(from, to);
        }
        throw new AccessDeniedException("ROLE_NOT_PERMITTED",
                String.format("Role %s may not move an order from %s to %s", role, from, to));
    }
}
