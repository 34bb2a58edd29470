package com.jasmin.threatguard.resilience;

import lombok.Getter;

@Getter
public class CircuitBreakerOpenException extends RuntimeException {
    private final String circuitName;

    public CircuitBreakerOpenException(String circuitName) {
        super("Circuit breaker '" + circuitName + "' is open");
        this.circuitName = circuitName;
    }
}
