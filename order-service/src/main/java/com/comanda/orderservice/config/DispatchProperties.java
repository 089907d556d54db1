package com.comanda.orderservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning for courier dispatch, bound from {@code comanda.dispatch.*}.
 */
@ConfigurationProperties(prefix = "comanda.dispatch")
@Getter
@Setter
public class DispatchProperties {

    // Dispatch attempts per order in one retry run (first try included)
    private int maxAttempts = 3;

    private long initialBackoffMs = 500;

    private double backoffMultiplier = 2.0;

    private long maxBackoffMs = 5_000;

    // Applied when a courier registers without stating a capacity
    private int defaultCourierCapacity = 2;

    private boolean sweepEnabled = true;

    private long sweepIntervalMs = 15_000;

    // READY_FOR_PICKUP orders waiting longer than this are reported to operators
    private Duration stuckThreshold = Duration.ofMinutes(15);
}
