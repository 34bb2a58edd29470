package com.jasmin.threatguard.detectors.waf;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.Detector;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.models.Violation;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(50)
@RequiredArgsConstructor
public class WafDetector implements Detector {

    private final WafService wafService;
    private final WafProperties props;

    @Override
    public Optional<DetectionVerdict> detect(SecurityEvent event) {
        if (!props.isEnabled()) return Optional.empty();

        WafResult result = wafService.inspect(event);
        if (!result.isBlocked()) {
            return Optional.empty();
        }
        Violation v = result.getBlockingViolation();
        return Optional.of(DetectionVerdict.builder()
                .status(403)
                .code(Constants.WAF_BLOCKED)
                .error("Request blocked by security rules")
                .ruleId(v.getRuleId())
                .category(v.getCategory())
                .build());
    }
}
