package com.jasmin.threatguard.detectors.intrusion;

import com.jasmin.threatguard.detectors.Detector;
import com.jasmin.threatguard.detectors.DetectorUtils;
import com.jasmin.threatguard.extractors.ExtractUtils;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.services.intrusion.InjectionType;
import com.jasmin.threatguard.services.intrusion.IntrusionPreventionService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the stateless injection detectors over the request surfaces. Types are checked in declaration order of
 * {@link InjectionType} and the first hit wins.
 */
@Component
@Order(60)
@RequiredArgsConstructor
public class InjectionDetector implements Detector {

    private final IntrusionPreventionService intrusionService;
    private final InjectionProperties props;

    @Override
    public Optional<DetectionVerdict> detect(SecurityEvent event) {
        if (!props.isEnabled()) return Optional.empty();

        String input = String.join("\n", surfaces(event));
        for (InjectionType type : InjectionType.values()) {
            if (intrusionService.matches(type, input)) {
                intrusionService.recordIntrusion(type, input, event);
                return Optional.of(DetectionVerdict.deny(403, type.code(), "Malicious input detected"));
            }
        }
        return Optional.empty();
    }

    private List<String> surfaces(SecurityEvent event) {
        List<String> out = new ArrayList<>();
        if (event.getPath() != null) {
            out.add(ExtractUtils.urlDecode(event.getPath()));
        }
        if (event.getQueryParams() != null) {
            event.getQueryParams().values().forEach(values -> {
                for (String v : values) {
                    if (v != null) out.add(ExtractUtils.urlDecode(v));
                }
            });
        }
        byte[] body = event.getBody();
        if (body != null && body.length > 0) {
            out.add(DetectorUtils.withDecodedForm(new String(body, StandardCharsets.UTF_8), event.getContentType()));
        }
        for (String header : props.getScannedHeaders()) {
            String value = DetectorUtils.firstHeaderMatch(event, List.of(header));
            if (!value.isEmpty()) out.add(value);
        }
        return out;
    }
}
