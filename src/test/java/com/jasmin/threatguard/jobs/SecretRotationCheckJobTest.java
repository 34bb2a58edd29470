package com.jasmin.threatguard.jobs;

import com.jasmin.threatguard.models.Severity;
import com.jasmin.threatguard.services.monitoring.AlertService;
import com.jasmin.threatguard.services.secrets.RotationStatus;
import com.jasmin.threatguard.services.secrets.SecretType;
import com.jasmin.threatguard.services.secrets.SecretsManagementService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SecretRotationCheckJobTest {

    @Mock
    private SecretsManagementService secretsService;
    @Mock
    private AlertService alertService;

    private SecretRotationCheckJob job;

    @BeforeEach
    void setUp() {
        job = new SecretRotationCheckJob(secretsService, alertService, new JobsProperties());
    }

    @Test
    void overdueSecretsRaiseOneAlert() {
        when(secretsService.getRotationStatus()).thenReturn(List.of(
                new RotationStatus(SecretType.JWT_SECRET, null, true),
                new RotationStatus(SecretType.SESSION_SECRET, Instant.parse("2025-02-20T00:00:00Z"), false)));

        job.runOnce();

        verify(alertService).createAlert(eq("secret_rotation_due"), eq(Severity.MEDIUM), anyString(),
                eq("jwt_secret should be rotated"), eq(Map.of("secretTypes", List.of("jwt_secret"))));
    }

    @Test
    void nothingDueRaisesNothing() {
        when(secretsService.getRotationStatus()).thenReturn(List.of(
                new RotationStatus(SecretType.JWT_SECRET, Instant.parse("2025-02-20T00:00:00Z"), false)));

        job.runOnce();

        verifyNoInteractions(alertService);
    }

    @Test
    void statusFailureIsContained() {
        when(secretsService.getRotationStatus()).thenThrow(new IllegalStateException("db down"));

        job.runOnce();

        verifyNoInteractions(alertService);
    }
}
