package com.jasmin.threatguard.services.monitoring;

import com.jasmin.threatguard.models.IncidentStatus;
import com.jasmin.threatguard.models.SecurityIncident;
import com.jasmin.threatguard.models.Severity;
import com.jasmin.threatguard.repositories.IncidentRepository;
import com.jasmin.threatguard.services.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.InstantSource;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@Service
@RequiredArgsConstructor
@Slf4j
public class IncidentService {

    private final IncidentRepository incidentRepository;
    private final AuditService auditService;
    private final InstantSource clock;

    public SecurityIncident createIncident(String type, Severity severity, String title, String description,
                                           List<String> affectedUsers, List<String> affectedIps, String actor) {
        if (type == null || type.isBlank() || title == null || title.isBlank()) {
            throw new IllegalArgumentException("Incident type and title are required");
        }
        SecurityIncident incident = SecurityIncident.builder()
                .type(type)
                .severity(severity == null ? Severity.MEDIUM : severity)
                .title(title)
                .description(description)
                .affectedUsers(affectedUsers == null ? List.of() : affectedUsers)
                .affectedIps(affectedIps == null ? List.of() : affectedIps)
                .status(IncidentStatus.OPEN)
                .createdAt(clock.instant())
                .build();
        incident.setId(incidentRepository.insert(incident));
        auditService.record("incident_created", actor, null, Map.of("incidentId", incident.getId(), "type", type));
        log.warn("Security incident opened: id={} type={} severity={}", incident.getId(), type, incident.getSeverity());
        return incident;
    }

    /**
     * Moves the incident along OPEN, INVESTIGATING, RESOLVED or FALSE_POSITIVE. Closing stamps the resolution time.
     */
    public SecurityIncident updateStatus(long id, IncidentStatus next, String notes, String actor) {
        SecurityIncident incident = incidentRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Incident not found: " + id));
        if (!incident.getStatus().canTransitionTo(next)) {
            throw new IllegalStateException("Incident " + id + " cannot move from " + incident.getStatus().value()
                    + " to " + next.value());
        }
        Instant resolvedAt = next.isClosed() ? clock.instant() : null;
        incidentRepository.updateStatus(id, next, notes, resolvedAt);
        incident.setStatus(next);
        incident.setResolvedAt(resolvedAt);
        if (notes != null) incident.setResolutionNotes(notes);

        auditService.record("incident_status_changed", actor, null, Map.of("incidentId", id, "status", next.value()));
        log.info("Incident status changed: id={} status={} actor={}", id, next.value(), actor);
        return incident;
    }

    public List<SecurityIncident> getRecentIncidents(int limit) {
        return incidentRepository.findRecent(limit);
    }
}
