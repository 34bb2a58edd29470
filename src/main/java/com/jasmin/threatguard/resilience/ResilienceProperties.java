package com.jasmin.threatguard.resilience;

import jakarta.validation.Valid;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "resilience")
public class ResilienceProperties {

    /** Used for names without their own entry. */
    @Valid
    private CircuitBreakerConfig defaults = new CircuitBreakerConfig();

    @Valid
    private Map<String, CircuitBreakerConfig> circuitBreakers = new LinkedHashMap<>();
}
