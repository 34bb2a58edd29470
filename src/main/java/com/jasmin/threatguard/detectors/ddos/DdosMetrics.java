package com.jasmin.threatguard.detectors.ddos;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class DdosMetrics {
    private long requestsPerMinute;
    private long uniqueIps;
    private ThreatLevel threatLevel;
    private boolean emergencyMode;
    private boolean tightLimits;
    private Instant timestamp;
}
