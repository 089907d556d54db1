package com.comanda.orderservice.config;

import com.comanda.orderservice.exception.ConcurrencyConflictException;
import com.comanda.orderservice.exception.NoCourierAvailableException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.util.List;

/**
 * Retry settings for courier dispatch. Only "try again later" failures are
 * retried: no courier free yet, or the order was touched concurrently.
 */
@Configuration
public class RetryConfig {

    @Bean
    public RetryTemplate dispatchRetryTemplate(DispatchProperties properties) {
        return RetryTemplate.builder()
                .maxAttempts(properties.getMaxAttempts())
                .exponentialBackoff(properties.getInitialBackoffMs(), properties.getBackoffMultiplier(),
                        properties.getMaxBackoffMs())
                .retryOn(List.of(NoCourierAvailableException.class, ConcurrencyConflictException.class))
                .build();
    }
}
