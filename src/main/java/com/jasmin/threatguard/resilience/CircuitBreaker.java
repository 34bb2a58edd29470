package com.jasmin.threatguard.resilience;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.function.Supplier;

/**
 * Three-state circuit breaker. CLOSED counts consecutive failures and opens at the failure threshold. OPEN
 * rejects calls until the timeout has elapsed, then HALF_OPEN admits one trial call at a time: a failed trial
 * reopens the circuit, enough successful trials close it.
 * <p>
 * State is guarded by this instance's monitor; the wrapped call itself runs outside of it.
 */
@Slf4j
public class CircuitBreaker {

    @Getter
    private final String name;
    private final CircuitBreakerConfig config;
    private final InstantSource clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureAt;
    private Instant nextAttemptAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, CircuitBreakerConfig config, InstantSource clock) {
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    public <T> T execute(Supplier<T> action) {
        return execute(action, null);
    }

    /**
     * Runs the action when the circuit admits it. A rejected or failed call returns the fallback's value when
     * one is given; otherwise a rejection throws {@link CircuitBreakerOpenException} and a failure rethrows.
     */
    public <T> T execute(Supplier<T> action, Supplier<T> fallback) {
        if (!tryAcquire()) {
            if (fallback != null) {
                return fallback.get();
            }
            throw new CircuitBreakerOpenException(name);
        }

        boolean recorded = false;
        try {
            T result = action.get();
            recorded = true;
            onSuccess();
            return result;
        } catch (RuntimeException e) {
            recorded = true;
            onFailure();
            if (fallback != null) {
                log.warn("Circuit breaker call failed, using fallback: name={} error={}", name, e.getMessage());
                return fallback.get();
            }
            throw e;
        } finally {
            // Errors and other throwables still release the half-open trial
            if (!recorded) {
                onFailure();
            }
        }
    }

    public void run(Runnable action) {
        execute(() -> {
            action.run();
            return null;
        });
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(name, state, failureCount, successCount,
                state == CircuitState.OPEN ? nextAttemptAt : null);
    }

    public synchronized void reset() {
        transitionTo(CircuitState.CLOSED);
        lastFailureAt = null;
        log.info("Circuit breaker reset: name={}", name);
    }

    private synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        switch (state) {
            case OPEN:
                if (now.isBefore(nextAttemptAt)) {
                    return false;
                }
                transitionTo(CircuitState.HALF_OPEN);
                trialInFlight = true;
                return true;
            case HALF_OPEN:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
            default:
                if (lastFailureAt != null
                        && !now.isBefore(lastFailureAt.plus(Duration.ofSeconds(config.getResetTimeoutSeconds())))) {
                    failureCount = 0;
                    successCount = 0;
                    lastFailureAt = null;
                }
                return true;
        }
    }

    private synchronized void onSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            successCount++;
            if (successCount >= config.getSuccessThreshold()) {
                transitionTo(CircuitState.CLOSED);
            }
        } else {
            failureCount = 0;
        }
    }

    private synchronized void onFailure() {
        lastFailureAt = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            transitionTo(CircuitState.OPEN);
            return;
        }
        failureCount++;
        if (state == CircuitState.CLOSED && failureCount >= config.getFailureThreshold()) {
            transitionTo(CircuitState.OPEN);
        }
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        switch (next) {
            case OPEN:
                nextAttemptAt = clock.instant().plus(Duration.ofSeconds(config.getTimeoutSeconds()));
                successCount = 0;
                break;
            case HALF_OPEN:
                successCount = 0;
                trialInFlight = false;
                break;
            default:
                failureCount = 0;
                successCount = 0;
                nextAttemptAt = null;
                trialInFlight = false;
                break;
        }
        if (previous != next) {
            log.warn("Circuit breaker state changed: name={} from={} to={}", name, previous, next);
        }
    }
}
