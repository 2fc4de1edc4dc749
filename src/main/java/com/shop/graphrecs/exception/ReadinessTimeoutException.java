package com.shop.graphrecs.exception;

import java.time.Duration;

/**
 * A dependent store did not answer its probe within the readiness timeout.
 * The cause is the failure of the last probe attempt.
 */
public class ReadinessTimeoutException extends RuntimeException {

    private final String storeName;
    private final int attempts;

    public ReadinessTimeoutException(String storeName, Duration timeout, int attempts, Throwable lastFailure) {
        super(String.format("%s store not reachable after %d attempts in %s: %s",
                storeName, attempts, timeout, lastFailure.getMessage()), lastFailure);
        this.storeName = storeName;
        this.attempts = attempts;
    }

    public String getStoreName() {
        return storeName;
    }

    public int getAttempts() {
        return attempts;
    }
}
