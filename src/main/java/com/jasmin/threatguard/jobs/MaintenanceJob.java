package com.jasmin.threatguard.jobs;

import com.jasmin.threatguard.repositories.AnomalyRepository;
import com.jasmin.threatguard.repositories.IntrusionAttemptRepository;
import com.jasmin.threatguard.repositories.IpBlockRepository;
import com.jasmin.threatguard.repositories.LoginAttemptRepository;
import com.jasmin.threatguard.repositories.ViolationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;

/**
 * Deletes records past their retention and block rows that have expired.
 */
@Component
@Slf4j
public class MaintenanceJob extends PeriodicJob {

    private final IntrusionAttemptRepository intrusionRepository;
    private final AnomalyRepository anomalyRepository;
    private final ViolationRepository violationRepository;
    private final LoginAttemptRepository loginAttemptRepository;
    private final IpBlockRepository ipBlockRepository;
    private final JobsProperties props;
    private final InstantSource clock;

    public MaintenanceJob(IntrusionAttemptRepository intrusionRepository,
                          AnomalyRepository anomalyRepository,
                          ViolationRepository violationRepository,
                          LoginAttemptRepository loginAttemptRepository,
                          IpBlockRepository ipBlockRepository,
                          JobsProperties props,
                          InstantSource clock) {
        super("maintenance", Duration.ofHours(props.getMaintenanceIntervalHours()));
        this.intrusionRepository = intrusionRepository;
        this.anomalyRepository = anomalyRepository;
        this.violationRepository = violationRepository;
        this.loginAttemptRepository = loginAttemptRepository;
        this.ipBlockRepository = ipBlockRepository;
        this.props = props;
        this.clock = clock;
    }

    @Override
    protected void execute() {
        Instant now = clock.instant();
        int intrusions = intrusionRepository.deleteOlderThan(now.minus(Duration.ofDays(props.getIntrusionRetentionDays())));
        int anomalies = anomalyRepository.deleteOlderThan(now.minus(Duration.ofDays(props.getAnomalyRetentionDays())));
        int violations = violationRepository.deleteOlderThan(now.minus(Duration.ofDays(props.getViolationRetentionDays())));
        int logins = loginAttemptRepository.deleteOlderThan(now.minus(Duration.ofDays(props.getLoginAttemptRetentionDays())));
        int blocks = ipBlockRepository.deleteExpired(now);
        log.info("Maintenance cleanup done: intrusions={} anomalies={} violations={} loginAttempts={} expiredBlocks={}",
                intrusions, anomalies, violations, logins, blocks);
    }
}
