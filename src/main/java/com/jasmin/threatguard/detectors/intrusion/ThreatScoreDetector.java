package com.jasmin.threatguard.detectors.intrusion;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.Detector;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.models.ThreatScore;
import com.jasmin.threatguard.services.intrusion.IntrusionPreventionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(80)
@RequiredArgsConstructor
@Slf4j
public class ThreatScoreDetector implements Detector {

    private final IntrusionPreventionService intrusionService;

    @Override
    public Optional<DetectionVerdict> detect(SecurityEvent event) {
        ThreatScore score = intrusionService.threatScoreFor(event);
        if (!score.isBlocked()) {
            return Optional.empty();
        }
        log.warn("High threat score: ip={} score={} factors={}", event.getIp(), score.getScore(), score.getFactors());
        return Optional.of(DetectionVerdict.deny(403, Constants.HIGH_THREAT_SCORE, "Access denied"));
    }
}
