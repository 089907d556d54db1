package com.comanda.orderservice.service.notification;

import com.comanda.common.contracts.NotificationContract;
import com.comanda.orderservice.config.AmqpConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Hands notifications to the notification service over RabbitMQ. The event
 * name is the routing key, so the consumer can bind per event type.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AmqpNotificationGateway implements NotificationGateway {

    private final RabbitTemplate rabbitTemplate;

    @Override
    public void notify(UUID userId, String event, NotificationContract payload) {
        if (userId == null) {
            log.debug("Skipping '{}' notification without recipient: orderId={}", event, payload.getOrderId());
            return;
        }
        payload.setRecipientId(userId);
        payload.setEvent(event);

        try {
            rabbitTemplate.convertAndSend(AmqpConfig.NOTIFICATION_EXCHANGE, event, payload);
            log.info("'{}' notification sent: recipientId={}, orderId={}", event, userId, payload.getOrderId());
        } catch (AmqpException e) {
            log.error("Failed to send '{}' notification: recipientId={}, orderId={}. Error: {}",
                    event, userId, payload.getOrderId(), e.getMessage());
        }
    }
}
