package com.jasmin.threatguard.resilience;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.InstantSource;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Named circuit breakers, created on first use from {@code resilience.circuit-breakers.<name>} or the defaults.
 */
@Component
@RequiredArgsConstructor
public class CircuitBreakerRegistry {

    private final ResilienceProperties props;
    private final InstantSource clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreaker get(String name) {
        return breakers.computeIfAbsent(name, n ->
                new CircuitBreaker(n, props.getCircuitBreakers().getOrDefault(n, props.getDefaults()), clock));
    }

    /** Stats of every configured breaker plus any created on demand. */
    public List<CircuitBreakerStats> getAllStats() {
        props.getCircuitBreakers().keySet().forEach(this::get);
        Collection<CircuitBreaker> all = breakers.values();
        return all.stream()
                .map(CircuitBreaker::getStats)
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .collect(Collectors.toList());
    }

    public void reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null && !props.getCircuitBreakers().containsKey(name)) {
            throw new NoSuchElementException("Unknown circuit breaker: " + name);
        }
        get(name).reset();
    }
}
