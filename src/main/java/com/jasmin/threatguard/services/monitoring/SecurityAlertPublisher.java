package com.jasmin.threatguard.services.monitoring;

import com.jasmin.threatguard.extractors.JsonUtils;
import com.jasmin.threatguard.models.SecurityAlert;
import com.jasmin.threatguard.resilience.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fans new alerts out on the Redis pub/sub channel. Delivery is best effort.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SecurityAlertPublisher {

    private final StringRedisTemplate redisTemplate;
    private final CircuitBreakerRegistry circuitBreakers;
    private final MonitoringProperties props;

    public void publishAlert(SecurityAlert alert) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("id", alert.getId());
        message.put("type", alert.getType());
        message.put("severity", alert.getSeverity().value());
        message.put("title", alert.getTitle());
        message.put("description", alert.getDescription());
        message.put("details", alert.getDetails());
        message.put("timestamp", alert.getCreatedAt().toString());

        try {
            String alertJson = JsonUtils.toJson(message);
            circuitBreakers.get(props.getAlertCircuitBreaker())
                    .run(() -> redisTemplate.convertAndSend(props.getAlertChannel(), alertJson));
        } catch (Exception e) {
            log.error("Failed to publish alert: id={} type={}", alert.getId(), alert.getType(), e);
        }
    }
}
