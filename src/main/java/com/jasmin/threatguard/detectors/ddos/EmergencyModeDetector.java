package com.jasmin.threatguard.detectors.ddos;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.Detector;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * While emergency mode is on, only critical endpoints are served.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class EmergencyModeDetector implements Detector {

    private final DdosProtectionService ddosService;
    private final DdosProperties props;

    @Override
    public Optional<DetectionVerdict> detect(SecurityEvent event) {
        if (!props.isEnabled() || ddosService.isCriticalEndpoint(event.getPath())) {
            return Optional.empty();
        }
        if (!ddosService.isEmergencyMode()) {
            return Optional.empty();
        }
        return Optional.of(DetectionVerdict.deny(503, Constants.EMERGENCY_MODE,
                "Service temporarily unavailable", props.getEmergencyRetryAfterSeconds()));
    }
}
