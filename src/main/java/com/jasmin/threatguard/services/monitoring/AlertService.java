package com.jasmin.threatguard.services.monitoring;

import com.jasmin.threatguard.models.AlertStatus;
import com.jasmin.threatguard.models.SecurityAlert;
import com.jasmin.threatguard.models.Severity;
import com.jasmin.threatguard.repositories.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AlertService {

    private final AlertRepository alertRepository;
    private final SecurityAlertPublisher publisher;
    private final MonitoringProperties props;
    private final InstantSource clock;

    /**
     * Raises a new alert unless one of the same type was raised within the dedup window.
     *
     * @return the stored alert, or empty when it was deduplicated
     */
    public Optional<SecurityAlert> createAlert(String type, Severity severity, String title, String description,
                                               Map<String, Object> details) {
        Instant now = clock.instant();
        if (alertRepository.existsByTypeSince(type, now.minus(Duration.ofMinutes(props.getAlertDedupMinutes())))) {
            log.debug("Alert suppressed as duplicate: type={}", type);
            return Optional.empty();
        }

        SecurityAlert alert = SecurityAlert.builder()
                .type(type)
                .severity(severity)
                .title(title)
                .description(description)
                .details(details)
                .status(AlertStatus.NEW)
                .createdAt(now)
                .build();
        alert.setId(alertRepository.insert(alert));

        if (severity == Severity.CRITICAL) {
            log.error("Security alert: id={} type={} severity={} title={}", alert.getId(), type, severity, title);
        } else {
            log.warn("Security alert: id={} type={} severity={} title={}", alert.getId(), type, severity, title);
        }
        publisher.publishAlert(alert);
        return Optional.of(alert);
    }

    public SecurityAlert acknowledge(long id, String actor) {
        return transition(id, AlertStatus.ACKNOWLEDGED, actor);
    }

    public SecurityAlert resolve(long id, String actor) {
        return transition(id, AlertStatus.RESOLVED, actor);
    }

    public SecurityAlert ignore(long id, String actor) {
        return transition(id, AlertStatus.IGNORED, actor);
    }

    private SecurityAlert transition(long id, AlertStatus next, String actor) {
        SecurityAlert alert = alertRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Alert not found: " + id));
        if (!alert.getStatus().canTransitionTo(next)) {
            throw new IllegalStateException("Alert " + id + " cannot move from " + alert.getStatus().value()
                    + " to " + next.value());
        }
        Instant now = clock.instant();
        alertRepository.updateStatus(id, next, actor, now);
        alert.setStatus(next);
        if (next == AlertStatus.ACKNOWLEDGED) {
            alert.setAcknowledgedBy(actor);
            alert.setAcknowledgedAt(now);
        } else {
            alert.setResolvedAt(now);
        }
        log.info("Alert status changed: id={} status={} actor={}", id, next.value(), actor);
        return alert;
    }

    public List<SecurityAlert> getActiveAlerts(int limit) {
        return alertRepository.findActive(limit);
    }
}
