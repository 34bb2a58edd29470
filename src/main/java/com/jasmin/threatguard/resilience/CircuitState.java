package com.jasmin.threatguard.resilience;

public enum CircuitState {
    CLOSED, OPEN, HALF_OPEN
}
