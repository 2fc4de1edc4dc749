package com.shop.graphrecs.service;

import com.shop.graphrecs.config.GraphRecsProperties;
import com.shop.graphrecs.exception.ReadinessTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReadinessGateTest {

    private ReadinessGate gate;

    @BeforeEach
    void setUp() {
        GraphRecsProperties properties = new GraphRecsProperties();
        properties.getReadiness().setTimeout(Duration.ofMillis(500));
        properties.getReadiness().setPollInterval(Duration.ofMillis(50));
        gate = new ReadinessGate(properties);
    }

    @Test
    void testReturnsImmediatelyWhenProbeSucceeds() {
        AtomicInteger calls = new AtomicInteger();

        gate.awaitReady("source", calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void testRetriesUntilProbeSucceeds() {
        AtomicInteger calls = new AtomicInteger();

        gate.awaitReady("graph", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ConnectException("connection refused");
            }
        });

        assertEquals(3, calls.get());
    }

    @Test
    void testTimesOutWithLastFailureAsCause() {
        AtomicInteger calls = new AtomicInteger();
        long start = System.nanoTime();

        ReadinessTimeoutException e = assertThrows(ReadinessTimeoutException.class,
                () -> gate.awaitReady("source", () -> {
                    throw new ConnectException("refused #" + calls.incrementAndGet());
                }));

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        assertTrue(elapsed.compareTo(Duration.ofMillis(500)) >= 0, "gave up early: " + elapsed);
        assertTrue(elapsed.compareTo(Duration.ofSeconds(3)) < 0, "gave up late: " + elapsed);
        assertEquals("source", e.getStoreName());
        assertEquals(calls.get(), e.getAttempts());
        assertInstanceOf(ConnectException.class, e.getCause());
        assertEquals("refused #" + calls.get(), e.getCause().getMessage());
    }
}
