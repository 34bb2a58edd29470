package com.jasmin.threatguard.resilience;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class CircuitBreakerStats {
    private String name;
    private CircuitState state;
    private int failureCount;
    private int successCount;

    // Only set while OPEN
    private Instant nextAttemptAt;
}
