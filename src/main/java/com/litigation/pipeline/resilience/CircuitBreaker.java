package com.litigation.pipeline.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;

/**
 * Consecutive-failure circuit breaker.
 *
 * <p>CLOSED counts consecutive failures and opens at the threshold. OPEN rejects every
 * call until the cooldown has elapsed, then lets a single trial call through (HALF_OPEN).
 * The trial's success closes the circuit; its failure opens it again for a new cooldown.</p>
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State { CLOSED, OPEN, HALF_OPEN }

    private final String name;
    private final CircuitBreakerConfig config;
    private final LongSupplier ticker;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private long openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, System::nanoTime);
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, LongSupplier ticker) {
        this.name = name;
        this.config = config;
        this.ticker = ticker;
    }

    /**
     * Whether a call may be attempted now. In HALF_OPEN only one trial call is admitted.
     */
    public synchronized boolean allowRequest() {
        if (state == State.OPEN && cooldownElapsed()) {
            state = State.HALF_OPEN;
            trialInFlight = false;
            log.info("circuit.half_open provider={}", name);
        }
        switch (state) {
            case CLOSED:
                return true;
            case HALF_OPEN:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
            default:
                return false;
        }
    }

    public synchronized void recordSuccess() {
        if (state != State.CLOSED) {
            log.info("circuit.closed provider={}", name);
        }
        state = State.CLOSED;
        consecutiveFailures = 0;
        trialInFlight = false;
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        if (state == State.HALF_OPEN || consecutiveFailures >= config.failureThreshold()) {
            if (state != State.OPEN) {
                log.warn("circuit.opened provider={} consecutiveFailures={} cooldown={}",
                        name, consecutiveFailures, config.cooldown());
            }
            state = State.OPEN;
            openedAt = ticker.getAsLong();
            trialInFlight = false;
        }
    }

    /**
     * Gives back a half-open trial slot whose call ended without a success or failure,
     * so the next caller can run the trial.
     */
    public synchronized void releaseTrial() {
        if (state == State.HALF_OPEN && trialInFlight) {
            trialInFlight = false;
            log.info("circuit.trial_released provider={}", name);
        }
    }

    /**
     * Current state. An open circuit whose cooldown has elapsed reports HALF_OPEN.
     */
    public synchronized State getState() {
        if (state == State.OPEN && cooldownElapsed()) {
            return State.HALF_OPEN;
        }
        return state;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public String getName() {
        return name;
    }

    private boolean cooldownElapsed() {
        return ticker.getAsLong() - openedAt >= config.cooldown().toNanos();
    }
}
