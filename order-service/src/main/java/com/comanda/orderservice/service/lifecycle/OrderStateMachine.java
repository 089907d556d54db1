package com.comanda.orderservice.service.lifecycle;

import com.comanda.orderservice.model.ActorRole;
import com.comanda.orderservice.model.AssignmentReleaseReason;
import com.comanda.orderservice.model.Order;
import com.comanda.orderservice.model.OrderStatus;
import com.comanda.orderservice.service.dispatch.DispatchAssigner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Applies one transition to a loaded order, including its courier side
 * effects. Persistence and version checks belong to the caller.
 *
 * Side effects run before the status changes; if one fails, the order is
 * left exactly as it was.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderStateMachine {

    private final DispatchAssigner dispatchAssigner;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void apply(Order order, OrderStatus target, ActorRole role) {
        OrderStatus from = order.getStatus();
        TransitionTable.check(from, target, role);

        switch (target) {
            case OUT_FOR_DELIVERY -> {
                UUID courierId = dispatchAssigner.assign(order);
                order.assignCourier(courierId);
            }
            case DELIVERED -> dispatchAssigner.release(order, AssignmentReleaseReason.DELIVERED);
            case CANCELLED -> {
                if (order.getCourierId() != null) {
                    dispatchAssigner.release(order, AssignmentReleaseReason.CANCELLED);
                    order.clearCourier();
                }
            }
            default -> {
            }
        }

        order.moveTo(target, Instant.now(clock));
        log.debug("Order moved: orderId={}, from={}, to={}, role={}", order.getId(), from, target, role);
    }
}
