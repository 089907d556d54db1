package com.comanda.orderservice.event;

import com.comanda.common.contracts.NotificationContract;
import com.comanda.orderservice.service.notification.NotificationGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.UUID;

/**
 * Turns committed order changes into user notifications. Runs after commit
 * on the notification executor, so a slow or failing broker never holds a
 * transaction open or undoes a transition.
 *
 * Recipients:
 * - restaurant: new order placed
 * - customer: confirmed, out for delivery, delivered, cancelled
 * - courier: assigned (or reassigned) to an order
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderNotificationListener {

    private final NotificationGateway notificationGateway;

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderTransitioned(OrderTransitionedEvent event) {
        switch (event.getToStatus()) {
            case PENDING -> send(restaurantRecipient(event), "order.placed", event, "New order received");
            case CONFIRMED -> send(event.getCustomerId(), "order.confirmed", event, "Your order was confirmed");
            case OUT_FOR_DELIVERY -> send(event.getCustomerId(), "order.out_for_delivery", event,
                    "Your order is on its way");
            case DELIVERED -> send(event.getCustomerId(), "order.delivered", event, "Your order was delivered");
            case CANCELLED -> send(event.getCustomerId(), "order.cancelled", event, "Your order was cancelled");
            default -> log.debug("No notification for status {}: orderId={}", event.getToStatus(), event.getOrderId());
        }
    }

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onCourierAssigned(CourierAssignedEvent event) {
        NotificationContract payload = NotificationContract.builder()
                .orderId(event.getOrderId())
                .orderNumber(event.getOrderNumber())
                .restaurantId(event.getRestaurantId())
                .courierId(event.getCourierId())
                .message(event.isReassignment() ? "An order was reassigned to you" : "New delivery assigned")
                .occurredAt(event.getOccurredAt())
                .build();
        notificationGateway.notify(event.getCourierId(), "courier.assigned", payload);
    }

    // Owner id is only known at placement; fall back to the restaurant's own inbox
    private UUID restaurantRecipient(OrderTransitionedEvent event) {
        return event.getRestaurantOwnerId() != null ? event.getRestaurantOwnerId() : event.getRestaurantId();
    }

    private void send(UUID recipient, String eventName, OrderTransitionedEvent event, String message) {
        NotificationContract payload = NotificationContract.builder()
                .orderId(event.getOrderId())
                .orderNumber(event.getOrderNumber())
                .status(event.getToStatus().name())
                .restaurantId(event.getRestaurantId())
                .courierId(event.getCourierId())
                .total(event.getTotal())
                .message(message)
                .occurredAt(event.getOccurredAt())
                .build();
        notificationGateway.notify(recipient, eventName, payload);
    }
}
