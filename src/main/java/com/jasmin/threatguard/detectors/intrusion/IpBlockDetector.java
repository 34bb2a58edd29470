package com.jasmin.threatguard.detectors.intrusion;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.Detector;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.services.intrusion.IntrusionPreventionService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(10)
@RequiredArgsConstructor
public class IpBlockDetector implements Detector {

    private final IntrusionPreventionService intrusionService;

    @Override
    public Optional<DetectionVerdict> detect(SecurityEvent event) {
        if (!intrusionService.isBlocked(event.getIp())) {
            return Optional.empty();
        }
        return Optional.of(DetectionVerdict.deny(403, Constants.IP_BLOCKED, "Access denied",
                intrusionService.remainingBlockSeconds(event.getIp())));
    }
}
