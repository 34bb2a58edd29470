package com.jasmin.threatguard.services.monitoring;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "monitoring")
public class MonitoringProperties {

    /** Alerts of a type already raised within this window are dropped. */
    @Positive
    private int alertDedupMinutes = 60;

    private String alertChannel = "security:alerts";
    private String alertCircuitBreaker = "alert-channel";

    // Periodic checks
    private long criticalIntrusionThreshold = 10;
    private long massBlockingThreshold = 100;

    // Dashboard
    @Positive
    private int recentIncidents = 10;
    @Positive
    private int activeAlerts = 50;
    @Positive
    private int topSources = 10;
    private int vulnerabilityScanMaxAgeDays = 7;
    private int inactiveSessionDays = 30;
    private long blockedIpRecommendationThreshold = 50;
}
