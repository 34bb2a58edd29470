package com.jasmin.threatguard.services.monitoring;

import com.jasmin.threatguard.detectors.waf.WafStats;
import com.jasmin.threatguard.services.secrets.RotationStatus;
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
public class SecurityReport {
    private Instant generatedAt;
    private Instant periodStart;
    private Instant periodEnd;
    private SecurityDashboard dashboard;
    private SecurityStats stats;
    private WafStats waf;
    private List<RotationStatus> secretRotation;
    private Summary summary;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Summary {
        private long totalIncidents;
        private long totalAlerts;
        private long totalIntrusions;
        private long totalAnomalies;
    }
}
