package com.jasmin.threatguard.detectors.ddos;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.Detector;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(30)
@RequiredArgsConstructor
public class DdosDetector implements Detector {

    private final DdosProtectionService ddosService;
    private final DdosProperties props;

    @Override
    public Optional<DetectionVerdict> detect(SecurityEvent event) {
        if (!props.isEnabled() || ddosService.isExempt(event.getPath())) {
            return Optional.empty();
        }

        if (props.isGeoBlockingEnabled() && ddosService.isCountryBlocked(event.getCountry())) {
            return Optional.of(DetectionVerdict.deny(403, Constants.GEO_BLOCKED,
                    "Access from your region is restricted"));
        }

        DdosCheckResult result = ddosService.checkForDdos(event.getIp(), event.getPath());
        event.setRateLimit(result.getIpLimit());
        event.setRateLimitRemaining(Math.max(0, result.getIpLimit() - result.getIpCount()));

        if (!result.isDetected()) {
            return Optional.empty();
        }
        return Optional.of(DetectionVerdict.deny(429, Constants.DDOS_DETECTED,
                "Too many requests", result.getRetryAfter()));
    }
}
