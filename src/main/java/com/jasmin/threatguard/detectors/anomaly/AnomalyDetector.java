package com.jasmin.threatguard.detectors.anomaly;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.Detector;
import com.jasmin.threatguard.models.AnomalyResult;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Authenticated requests only: account takeover first, then the behavior anomaly score.
 */
@Component
@Order(100)
@RequiredArgsConstructor
public class AnomalyDetector implements Detector {

    private final AccountTakeoverService takeoverService;
    private final AnomalyDetectionService anomalyService;
    private final AccountTakeoverProperties takeoverProps;
    private final AnomalyProperties anomalyProps;

    @Override
    public Optional<DetectionVerdict> detect(SecurityEvent event) {
        if (!event.isAuthenticated()) {
            return Optional.empty();
        }

        if (takeoverProps.isEnabled()) {
            TakeoverAssessment takeover = takeoverService.assess(event.getUserId(), event.getSessionId(),
                    event.getIp(), event.getUserAgent());
            if (takeover.isSuspicious()) {
                return Optional.of(DetectionVerdict.builder()
                        .status(403)
                        .code(Constants.ACCOUNT_TAKEOVER_SUSPECTED)
                        .error("Please sign in again")
                        .reauthRequired(true)
                        .build());
            }
        }

        if (anomalyProps.isEnabled()) {
            AnomalyResult result = anomalyService.detectAnomalies(event.getUserId(), event.getIp(),
                    event.getUserAgent(), event.getPath());
            if (result.isShouldBlock()) {
                return Optional.of(DetectionVerdict.deny(403, Constants.ANOMALY_DETECTED, "Unusual account activity"));
            }
        }
        return Optional.empty();
    }
}
