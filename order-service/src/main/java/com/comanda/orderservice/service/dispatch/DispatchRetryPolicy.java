package com.comanda.orderservice.service.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Bounded, backed-off repetition of a dispatch attempt. Lives outside the
 * state machine: the machine makes exactly one attempt per call and this
 * policy decides whether to call again.
 */
@Component
@Slf4j
public class DispatchRetryPolicy {

    private final RetryTemplate retryTemplate;

    public DispatchRetryPolicy(@Qualifier("dispatchRetryTemplate") RetryTemplate retryTemplate) {
        this.retryTemplate = retryTemplate;
    }

    /**
     * Runs {@code attempt} until it succeeds, fails with a non-retryable
     * error, or the attempts run out; the last failure is rethrown.
     */
    public <T> T execute(UUID orderId, Supplier<T> attempt) {
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.info("Retrying dispatch: orderId={}, attempt={}, lastError={}",
                        orderId, context.getRetryCount() + 1,
                        context.getLastThrowable() == null ? null : context.getLastThrowable().getMessage());
            }
            return attempt.get();
        });
    }
}
