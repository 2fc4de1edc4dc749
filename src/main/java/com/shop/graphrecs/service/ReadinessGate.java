package com.shop.graphrecs.service;

import com.shop.graphrecs.config.GraphRecsProperties;
import com.shop.graphrecs.exception.ReadinessTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Blocks until a store answers its probe. Polls at a fixed interval, no backoff.
 */
@Service
@Slf4j
public class ReadinessGate {

    private final Duration timeout;
    private final Duration pollInterval;

    public ReadinessGate(GraphRecsProperties properties) {
        this.timeout = properties.getReadiness().getTimeout();
        this.pollInterval = properties.getReadiness().getPollInterval();
    }

    /**
     * Call the probe until it succeeds.
     *
     * @throws ReadinessTimeoutException once a probe fails after the timeout has elapsed
     */
    public void awaitReady(String storeName, StoreProbe probe) {
        long start = System.nanoTime();
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                probe.check();
                log.info("{} store ready after {} attempt(s)", storeName, attempts);
                return;
            } catch (Exception e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                if (elapsed.compareTo(timeout) > 0) {
                    log.error("{} store still unreachable after {} ({} attempts)", storeName, elapsed, attempts);
                    throw new ReadinessTimeoutException(storeName, timeout, attempts, e);
                }
                log.debug("{} store not ready yet (attempt {}): {}", storeName, attempts, e.getMessage());
            }
            sleep();
        }
    }

    private void sleep() {
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a store", e);
        }
    }
}
