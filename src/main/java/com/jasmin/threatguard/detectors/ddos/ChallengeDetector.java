package com.jasmin.threatguard.detectors.ddos;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.Detector;
import com.jasmin.threatguard.detectors.DetectorUtils;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Challenge-response gate for clients whose threat score is above the challenge threshold.
 * A supplied answer is always verified, even when the client would not be challenged.
 */
@Component
@Order(40)
@RequiredArgsConstructor
public class ChallengeDetector implements Detector {

    private final DdosProtectionService ddosService;
    private final DdosProperties props;

    @Override
    public Optional<DetectionVerdict> detect(SecurityEvent event) {
        if (!props.isEnabled() || ddosService.isExempt(event.getPath())) {
            return Optional.empty();
        }
        String ip = event.getIp();
        if (ddosService.hasPassedChallenge(ip)) {
            return Optional.empty();
        }

        String response = DetectorUtils.firstHeaderMatch(event, List.of(Constants.CHALLENGE_HEADER));
        if (!response.isEmpty()) {
            if (ddosService.verifyChallenge(ip, response)) {
                return Optional.empty();
            }
            return Optional.of(DetectionVerdict.deny(403, Constants.INVALID_CHALLENGE, "Invalid challenge response"));
        }

        if (!ddosService.requireChallenge(event)) {
            return Optional.empty();
        }
        return Optional.of(DetectionVerdict.builder()
                .status(403)
                .code(Constants.CHALLENGE_REQUIRED)
                .error("Challenge required")
                .challenge(ddosService.generateChallenge(ip))
                .build());
    }
}
