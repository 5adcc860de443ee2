package com.jreinhal.hragent.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GatewayCircuitBreakerTest {

    private final AtomicLong now = new AtomicLong(1_000L);
    private GatewayCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        breaker = new GatewayCircuitBreaker(3, Duration.ofSeconds(10), 1, now::get);
    }

    @Test
    @DisplayName("Stays closed below the failure threshold")
    void closedBelowThreshold() {
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(GatewayCircuitBreaker.State.CLOSED, breaker.getState());
        assertTrue(breaker.allowRequest());
    }

    @Test
    @DisplayName("Success resets the consecutive failure count")
    void successResets() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertEquals(GatewayCircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    @DisplayName("Opens at the threshold and rejects until the open period ends")
    void opens() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(GatewayCircuitBreaker.State.OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
        assertEquals(10_000L, breaker.remainingOpenMs());

        now.addAndGet(4_000L);
        assertEquals(6_000L, breaker.remainingOpenMs());
    }

    @Test
    @DisplayName("Half-open admits one trial call; success closes the circuit")
    void trialCallSuccess() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordFailure();
        now.addAndGet(10_000L);

        assertTrue(breaker.allowRequest());
        assertEquals(GatewayCircuitBreaker.State.HALF_OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());

        breaker.recordSuccess();
        assertEquals(GatewayCircuitBreaker.State.CLOSED, breaker.getState());
        assertTrue(breaker.allowRequest());
    }

    @Test
    @DisplayName("Failed trial call reopens the circuit")
    void trialCallFailure() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordFailure();
        now.addAndGet(10_000L);
        breaker.allowRequest();

        breaker.recordFailure();

        assertEquals(GatewayCircuitBreaker.State.OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
    }
}
