package com.jasmin.threatguard.jobs;

import com.jasmin.threatguard.services.monitoring.SecurityMonitoringService;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class SecurityMonitoringJob extends PeriodicJob {

    private final SecurityMonitoringService monitoringService;

    public SecurityMonitoringJob(SecurityMonitoringService monitoringService, JobsProperties props) {
        super("security-monitoring", Duration.ofSeconds(props.getMonitoringIntervalSeconds()));
        this.monitoringService = monitoringService;
    }

    @Override
    protected void execute() {
        monitoringService.runChecks();
    }
}
