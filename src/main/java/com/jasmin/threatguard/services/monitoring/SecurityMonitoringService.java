package com.jasmin.threatguard.services.monitoring;

import com.jasmin.threatguard.detectors.anomaly.AnomalyDetectionService;
import com.jasmin.threatguard.detectors.anomaly.AnomalyStats;
import com.jasmin.threatguard.detectors.ddos.DdosMetrics;
import com.jasmin.threatguard.detectors.ddos.DdosProtectionService;
import com.jasmin.threatguard.detectors.ddos.ThreatLevel;
import com.jasmin.threatguard.models.Severity;
import com.jasmin.threatguard.services.intrusion.IntrusionPreventionService;
import com.jasmin.threatguard.services.intrusion.IntrusionStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * One monitoring pass: raises alerts from the DDoS, anomaly, intrusion and block metrics, then lets the DDoS
 * component reconcile emergency mode. Every check runs even when an earlier one fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SecurityMonitoringService {

    private final DdosProtectionService ddosService;
    private final AnomalyDetectionService anomalyService;
    private final IntrusionPreventionService intrusionService;
    private final AlertService alertService;
    private final MonitoringProperties props;

    public void runChecks() {
        guarded("ddos", this::checkDdos);
        guarded("anomalies", this::checkAnomalies);
        guarded("intrusions", this::checkIntrusions);
        guarded("blocks", this::checkBlocks);
        guarded("auto-scale", ddosService::autoScale);
    }

    void checkDdos() {
        DdosMetrics metrics = ddosService.getMetrics();
        Map<String, Object> details = Map.of(
                "requestsPerMinute", metrics.getRequestsPerMinute(),
                "uniqueIps", metrics.getUniqueIps(),
                "emergencyMode", metrics.isEmergencyMode());
        if (metrics.getThreatLevel() == ThreatLevel.CRITICAL) {
            alertService.createAlert("ddos_attack", Severity.CRITICAL, "Critical DDoS attack detected",
                    "Request rate " + metrics.getRequestsPerMinute() + " per minute exceeds the global threshold", details);
        } else if (metrics.getThreatLevel() == ThreatLevel.HIGH) {
            alertService.createAlert("ddos_warning", Severity.HIGH, "Elevated DDoS threat level",
                    "Suspicious traffic patterns detected", details);
        }
    }

    void checkAnomalies() {
        AnomalyStats stats = anomalyService.getAnomalyStats(1);
        if (stats.getCritical() > 0) {
            alertService.createAlert("critical_anomalies", Severity.HIGH, "Critical user behavior anomalies",
                    stats.getCritical() + " critical anomalies in the last hour", Map.of("critical", stats.getCritical()));
        }
    }

    void checkIntrusions() {
        IntrusionStats stats = intrusionService.getIntrusionStats(1);
        if (stats.getCritical() > props.getCriticalIntrusionThreshold()) {
            alertService.createAlert("intrusion_spike", Severity.CRITICAL, "Spike of critical intrusion attempts",
                    stats.getCritical() + " critical intrusion attempts in the last hour",
                    Map.of("critical", stats.getCritical(), "total", stats.getTotal()));
        }
    }

    void checkBlocks() {
        long active = intrusionService.countActiveBlocks();
        if (active > props.getMassBlockingThreshold()) {
            alertService.createAlert("mass_blocking", Severity.HIGH, "Unusually many blocked IPs",
                    active + " IP addresses are currently blocked", Map.of("activeBlocks", active));
        }
    }

    private void guarded(String check, Runnable action) {
        try {
            action.run();
        } catch (Exception e) {
            log.error("Security check failed: check={}", check, e);
        }
    }
}
