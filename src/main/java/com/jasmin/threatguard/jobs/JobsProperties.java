package com.jasmin.threatguard.jobs;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "jobs")
public class JobsProperties {
    private boolean enabled = true;

    @Positive
    private int poolSize = 2;

    @Positive
    private long monitoringIntervalSeconds = 60;
    @Positive
    private long maintenanceIntervalHours = 24;
    @Positive
    private long profileRefreshIntervalHours = 24;
    @Positive
    private long rotationCheckIntervalDays = 7;

    // Retention of the maintenance cleanup
    @Positive
    private int intrusionRetentionDays = 90;
    @Positive
    private int anomalyRetentionDays = 90;
    @Positive
    private int violationRetentionDays = 90;
    @Positive
    private int loginAttemptRetentionDays = 30;
}
