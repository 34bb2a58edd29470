package com.jasmin.threatguard.services.monitoring;

import com.jasmin.threatguard.detectors.ddos.ThreatLevel;
import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.SecurityIncident;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SecurityDashboard {
    private Overview overview;
    private List<SecurityIncident> recentIncidents;

    // Intrusion attempts by type, last 24 hours
    private List<CountByKey> topThreats;

    private ThreatSources topThreatSources;
    private Metrics metrics;
    private List<String> recommendations;
    private Instant generatedAt;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Overview {
        private ThreatLevel threatLevel;
        private long activeIncidents;
        private long blockedIps;
        private long activeAlerts;
        private List<CountByKey> alertsBySeverity;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class ThreatSources {
        private List<CountByKey> wafOffenders;
        private List<CountByKey> ddosAttackers;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Metrics {
        private long intrusionAttempts;
        private long ddosAttempts;
        private long anomaliesDetected;
        private long wafBlocks;
    }
}
