package com.jasmin.threatguard.jobs;

import com.jasmin.threatguard.repositories.AnomalyRepository;
import com.jasmin.threatguard.repositories.IntrusionAttemptRepository;
import com.jasmin.threatguard.repositories.IpBlockRepository;
import com.jasmin.threatguard.repositories.LoginAttemptRepository;
import com.jasmin.threatguard.repositories.ViolationRepository;
import com.jasmin.threatguard.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MaintenanceJobTest {

    private static final Instant NOW = Instant.parse("2025-03-01T03:00:00Z");

    @Mock
    private IntrusionAttemptRepository intrusionRepository;
    @Mock
    private AnomalyRepository anomalyRepository;
    @Mock
    private ViolationRepository violationRepository;
    @Mock
    private LoginAttemptRepository loginAttemptRepository;
    @Mock
    private IpBlockRepository ipBlockRepository;

    @Test
    void deletesEachTableWithItsOwnRetention() {
        JobsProperties props = new JobsProperties();
        props.setLoginAttemptRetentionDays(14);
        MaintenanceJob job = new MaintenanceJob(intrusionRepository, anomalyRepository, violationRepository,
                loginAttemptRepository, ipBlockRepository, props, new MutableClock(NOW));

        assertThat(job.getInterval()).isEqualTo(Duration.ofHours(24));
        assertThat(job.runOnce()).isTrue();

        verify(intrusionRepository).deleteOlderThan(NOW.minus(Duration.ofDays(90)));
        verify(anomalyRepository).deleteOlderThan(NOW.minus(Duration.ofDays(90)));
        verify(violationRepository).deleteOlderThan(NOW.minus(Duration.ofDays(90)));
        verify(loginAttemptRepository).deleteOlderThan(NOW.minus(Duration.ofDays(14)));
        verify(ipBlockRepository).deleteExpired(NOW);
    }

    @Test
    void failureStopsTheRunButNotTheJob() {
        when(intrusionRepository.deleteOlderThan(NOW.minus(Duration.ofDays(90))))
                .thenThrow(new IllegalStateException("db down"));
        MaintenanceJob job = new MaintenanceJob(intrusionRepository, anomalyRepository, violationRepository,
                loginAttemptRepository, ipBlockRepository, new JobsProperties(), new MutableClock(NOW));

        assertThat(job.runOnce()).isTrue();
        assertThat(job.isRunning()).isFalse();
    }
}
