package com.jasmin.threatguard.controllers;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.controllers.dto.CreateIncidentRequest;
import com.jasmin.threatguard.controllers.dto.IncidentStatusRequest;
import com.jasmin.threatguard.models.IncidentStatus;
import com.jasmin.threatguard.models.SecurityAlert;
import com.jasmin.threatguard.models.SecurityIncident;
import com.jasmin.threatguard.services.monitoring.AlertService;
import com.jasmin.threatguard.services.monitoring.DashboardService;
import com.jasmin.threatguard.services.monitoring.IncidentService;
import com.jasmin.threatguard.services.monitoring.SecurityDashboard;
import com.jasmin.threatguard.services.monitoring.SecurityReport;
import com.jasmin.threatguard.services.monitoring.SecurityStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/security")
public class SecurityMonitoringController {
    private final DashboardService dashboardService;
    private final AlertService alertService;
    private final IncidentService incidentService;

    @GetMapping("/dashboard")
    public SecurityDashboard getDashboard() {
        return dashboardService.getDashboard();
    }

    @GetMapping("/report")
    public SecurityReport getReport(@RequestParam(defaultValue = "30") int days) {
        return dashboardService.generateReport(Params.checkRange("days", days, 1, 365));
    }

    @GetMapping("/stats")
    public SecurityStats getStats(@RequestParam(defaultValue = "7") int days) {
        return dashboardService.getSecurityStats(Params.checkRange("days", days, 1, 365));
    }

    @GetMapping("/alerts")
    public List<SecurityAlert> getActiveAlerts(@RequestParam(defaultValue = "50") int limit) {
        return alertService.getActiveAlerts(Params.checkLimit(limit));
    }

    @PostMapping("/alerts/{id}/acknowledge")
    public SecurityAlert acknowledge(@PathVariable long id,
                                     @RequestAttribute(Constants.OPERATOR_ATTRIBUTE) String actor) {
        return alertService.acknowledge(id, actor);
    }

    @PostMapping("/alerts/{id}/resolve")
    public SecurityAlert resolve(@PathVariable long id,
                                 @RequestAttribute(Constants.OPERATOR_ATTRIBUTE) String actor) {
        return alertService.resolve(id, actor);
    }

    @PostMapping("/alerts/{id}/ignore")
    public SecurityAlert ignore(@PathVariable long id,
                                @RequestAttribute(Constants.OPERATOR_ATTRIBUTE) String actor) {
        return alertService.ignore(id, actor);
    }

    @GetMapping("/incidents")
    public List<SecurityIncident> getIncidents(@RequestParam(defaultValue = "10") int limit) {
        return incidentService.getRecentIncidents(Params.checkLimit(limit));
    }

    @PostMapping("/incidents")
    @ResponseStatus(HttpStatus.CREATED)
    public SecurityIncident createIncident(@Valid @RequestBody CreateIncidentRequest request,
                                           @RequestAttribute(Constants.OPERATOR_ATTRIBUTE) String actor) {
        return incidentService.createIncident(request.getType(), request.getSeverity(), request.getTitle(),
                request.getDescription(), request.getAffectedUsers(), request.getAffectedIps(), actor);
    }

    @PatchMapping("/incidents/{id}/status")
    public SecurityIncident updateIncidentStatus(@PathVariable long id,
                                                 @Valid @RequestBody IncidentStatusRequest request,
                                                 @RequestAttribute(Constants.OPERATOR_ATTRIBUTE) String actor) {
        return incidentService.updateStatus(id, IncidentStatus.fromValue(request.getStatus()), request.getNotes(), actor);
    }
}
