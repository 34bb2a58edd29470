package com.jasmin.threatguard.resilience;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class CircuitBreakerConfig {
    /** Consecutive failures that open the circuit. */
    @Positive
    private int failureThreshold = 5;

    /** Successful trial calls needed to close a half-open circuit. */
    @Positive
    private int successThreshold = 2;

    /** How long an open circuit rejects calls before allowing a trial. */
    @Positive
    private long timeoutSeconds = 60;

    /** Failure and success counts are forgotten after this long without a failure. */
    @Positive
    private long resetTimeoutSeconds = 300;
}
