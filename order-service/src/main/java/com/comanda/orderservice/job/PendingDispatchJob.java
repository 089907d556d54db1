package com.comanda.orderservice.job;

import com.comanda.common.exception.EngineException;
import com.comanda.orderservice.config.DispatchProperties;
import com.comanda.orderservice.dto.OrderResponse;
import com.comanda.orderservice.exception.NoCourierAvailableException;
import com.comanda.orderservice.service.lifecycle.OrderLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Picks up READY_FOR_PICKUP orders whose immediate dispatch found no free
 * courier and gives each one a single attempt, oldest first. The sweep stops
 * at the first order that finds no courier; the rest wait for the next run.
 * Orders waiting past the stuck threshold are reported for an operator;
 * nothing is cancelled here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "comanda.dispatch", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
public class PendingDispatchJob {

    private final OrderLifecycleService orderLifecycleService;
    private final DispatchProperties dispatchProperties;

    @Scheduled(fixedDelayString = "${comanda.dispatch.sweep-interval-ms:15000}")
    public void dispatchWaitingOrders() {
        List<OrderResponse> waiting = orderLifecycleService.findOrdersAwaitingDispatch(Duration.ZERO);
        if (waiting.isEmpty()) {
            return;
        }
        log.debug("Found {} orders waiting for a courier", waiting.size());

        int dispatched = 0;
        for (OrderResponse order : waiting) {
            try {
                orderLifecycleService.dispatch(order.getId());
                dispatched++;
            } catch (NoCourierAvailableException e) {
                log.info("No courier free, sweep stops early: orderId={}", order.getId());
                break;
            } catch (EngineException e) {
                log.info("Order still waiting for a courier: orderId={}, reason={}", order.getId(), e.getErrorCode());
            }
        }
        log.info("Dispatch sweep finished: waiting={}, dispatched={}", waiting.size(), dispatched);

        reportStuckOrders();
    }

    private void reportStuckOrders() {
        Duration threshold = dispatchProperties.getStuckThreshold();
        List<OrderResponse> stuck = orderLifecycleService.findOrdersAwaitingDispatch(threshold);
        for (OrderResponse order : stuck) {
            log.warn("Order waiting for a courier longer than {}: orderId={}, orderNumber={}, readyAt={}",
                    threshold, order.getId(), order.getOrderNumber(), order.getReadyAt());
        }
    }
}
