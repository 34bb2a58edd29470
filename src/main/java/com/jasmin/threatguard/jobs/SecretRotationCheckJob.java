package com.jasmin.threatguard.jobs;

import com.jasmin.threatguard.models.Severity;
import com.jasmin.threatguard.services.monitoring.AlertService;
import com.jasmin.threatguard.services.secrets.RotationStatus;
import com.jasmin.threatguard.services.secrets.SecretsManagementService;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raises a {@code secret_rotation_due} alert for secrets past their rotation interval. Rotation itself stays
 * an operator action.
 */
@Component
public class SecretRotationCheckJob extends PeriodicJob {

    private final SecretsManagementService secretsService;
    private final AlertService alertService;

    public SecretRotationCheckJob(SecretsManagementService secretsService, AlertService alertService, JobsProperties props) {
        super("secret-rotation-check", Duration.ofDays(props.getRotationCheckIntervalDays()));
        this.secretsService = secretsService;
        this.alertService = alertService;
    }

    @Override
    protected void execute() {
        List<String> due = secretsService.getRotationStatus().stream()
                .filter(RotationStatus::isRotationNeeded)
                .map(s -> s.getSecretType().value())
                .collect(Collectors.toList());
        if (due.isEmpty()) {
            return;
        }
        alertService.createAlert("secret_rotation_due", Severity.MEDIUM, "Secrets due for rotation",
                String.join(", ", due) + " should be rotated", Map.of("secretTypes", due));
    }
}
