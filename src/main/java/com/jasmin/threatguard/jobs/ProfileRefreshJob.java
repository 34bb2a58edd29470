package com.jasmin.threatguard.jobs;

import com.jasmin.threatguard.detectors.anomaly.AnomalyDetectionService;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ProfileRefreshJob extends PeriodicJob {

    private final AnomalyDetectionService anomalyService;

    public ProfileRefreshJob(AnomalyDetectionService anomalyService, JobsProperties props) {
        super("profile-refresh", Duration.ofHours(props.getProfileRefreshIntervalHours()));
        this.anomalyService = anomalyService;
    }

    @Override
    protected void execute() {
        anomalyService.updateAllProfiles();
    }
}
