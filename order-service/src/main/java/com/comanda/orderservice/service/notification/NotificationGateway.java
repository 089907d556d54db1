package com.comanda.orderservice.service.notification;

import com.comanda.common.contracts.NotificationContract;

import java.util.UUID;

/**
 * Fire-and-forget delivery of user notifications. Implementations must not
 * throw: a lost notification never affects the order.
 */
public interface NotificationGateway {

    void notify(UUID userId, String event, NotificationContract payload);
}
