package com.jasmin.threatguard.controllers;

import com.jasmin.threatguard.resilience.CircuitBreakerRegistry;
import com.jasmin.threatguard.resilience.CircuitBreakerStats;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/security/circuit-breakers")
public class CircuitBreakerController {
    private final CircuitBreakerRegistry registry;

    @GetMapping
    public List<CircuitBreakerStats> getStats() {
        return registry.getAllStats();
    }

    @PostMapping("/{name}/reset")
    public CircuitBreakerStats reset(@PathVariable String name) {
        registry.reset(name);
        return registry.get(name).getStats();
    }
}
