package com.comanda.orderservice.service.notification;

import com.comanda.common.contracts.NotificationContract;
import com.comanda.orderservice.config.AmqpConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AmqpNotificationGatewayTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    @InjectMocks
    private AmqpNotificationGateway gateway;

    @Test
    void notify_SendsToNotificationExchangeWithEventAsRoutingKey() {
        UUID userId = UUID.randomUUID();
        NotificationContract payload = NotificationContract.builder().orderId(UUID.randomUUID()).build();

        gateway.notify(userId, "order.delivered", payload);

        verify(rabbitTemplate).convertAndSend(AmqpConfig.NOTIFICATION_EXCHANGE, "order.delivered", payload);
        assertThat(payload.getRecipientId()).isEqualTo(userId);
        assertThat(payload.getEvent()).isEqualTo("order.delivered");
    }

    @Test
    void notify_BrokerDown_DoesNotThrow() {
        doThrow(new AmqpConnectException(new ConnectException("refused")))
                .when(rabbitTemplate).convertAndSend(anyString(), anyString(), any(Object.class));

        assertThatCode(() -> gateway.notify(UUID.randomUUID(), "order.confirmed",
                NotificationContract.builder().build())).doesNotThrowAnyException();
    }

    @Test
    void notify_WithoutRecipient_IsSkipped() {
        gateway.notify(null, "order.placed", NotificationContract.builder().build());

        verifyNoInteractions(rabbitTemplate);
    }
}
