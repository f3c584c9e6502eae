package com.yerin.submitflow.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Pauses queue polling after consecutive trigger failures. After the cooldown one poll is let
 * through (half-open); its outcome closes or re-opens the breaker.
 */
@Slf4j
@Component
public class TriggerCircuitBreaker {

    public enum State { CLOSED, OPEN, HALF_OPEN }

    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;

    @Autowired
    public TriggerCircuitBreaker(@Value("${submitflow.subscriber.breaker.failure-threshold:5}") int failureThreshold,
                                 @Value("${submitflow.subscriber.breaker.cooldown-ms:60000}") long cooldownMs,
                                 Clock clock) {
        this.failureThreshold = failureThreshold;
        this.cooldown = Duration.ofMillis(cooldownMs);
        this.clock = clock;
    }

    public synchronized boolean allowRequest() {
        if (state == State.OPEN && !clock.instant().isBefore(openedAt.plus(cooldown))) {
            state = State.HALF_OPEN;
            log.info("[Breaker] half-open after cooldown={}ms", cooldown.toMillis());
        }
        return state != State.OPEN;
    }

    public synchronized void recordSuccess() {
        if (state != State.CLOSED) log.info("[Breaker] closed");
        state = State.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        if (state == State.HALF_OPEN || consecutiveFailures >= failureThreshold) {
            if (state != State.OPEN) {
                log.warn("[Breaker] open failures={}, cooldown={}ms", consecutiveFailures, cooldown.toMillis());
            }
            state = State.OPEN;
            openedAt = clock.instant();
        }
    }

    public synchronized Duration remainingCooldown() {
        if (state != State.OPEN) return Duration.ZERO;
        Duration left = Duration.between(clock.instant(), openedAt.plus(cooldown));
        return left.isNegative() ? Duration.ZERO : left;
    }

    public synchronized State state() {
        return state;
    }
}
