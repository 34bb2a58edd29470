package com.jasmin.threatguard.services.monitoring;

import com.jasmin.threatguard.models.AlertStatus;
import com.jasmin.threatguard.models.SecurityAlert;
import com.jasmin.threatguard.models.Severity;
import com.jasmin.threatguard.resilience.CircuitBreakerConfig;
import com.jasmin.threatguard.resilience.CircuitBreakerRegistry;
import com.jasmin.threatguard.resilience.CircuitState;
import com.jasmin.threatguard.resilience.ResilienceProperties;
import com.jasmin.threatguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SecurityAlertPublisherTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    private CircuitBreakerRegistry registry;
    private SecurityAlertPublisher publisher;

    @BeforeEach
    void setUp() {
        ResilienceProperties resilience = new ResilienceProperties();
        resilience.getCircuitBreakers().put("alert-channel", new CircuitBreakerConfig(2, 1, 60, 300));
        registry = new CircuitBreakerRegistry(resilience, MutableClock.at("2025-03-01T10:00:00Z"));
        publisher = new SecurityAlertPublisher(redisTemplate, registry, new MonitoringProperties());
    }

    private static SecurityAlert alert() {
        return SecurityAlert.builder()
                .id(11L)
                .type("mass_blocking")
                .severity(Severity.HIGH)
                .title("Unusually many blocked IPs")
                .details(Map.of("activeBlocks", 120))
                .status(AlertStatus.NEW)
                .createdAt(Instant.parse("2025-03-01T10:00:00Z"))
                .build();
    }

    @Test
    void alertIsPublishedAsJsonOnTheChannel() {
        publisher.publishAlert(alert());

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq("security:alerts"), json.capture());
        assertThat(json.getValue())
                .contains("\"type\":\"mass_blocking\"")
                .contains("\"severity\":\"high\"")
                .contains("\"timestamp\":\"2025-03-01T10:00:00Z\"");
    }

    @Test
    void deliveryFailuresAreContainedAndOpenTheBreaker() {
        when(redisTemplate.convertAndSend(anyString(), anyString())).thenThrow(new IllegalStateException("redis down"));

        publisher.publishAlert(alert());
        publisher.publishAlert(alert());
        publisher.publishAlert(alert());

        assertThat(registry.get("alert-channel").getState()).isEqualTo(CircuitState.OPEN);
        verify(redisTemplate, times(2)).convertAndSend(anyString(), anyString());
    }
}
