package com.jasmin.threatguard.engine;

import com.jasmin.threatguard.detectors.Detector;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs the detectors in their {@code @Order} and stops at the first verdict. A detector that throws is logged
 * and skipped, so infrastructure trouble never denies a request on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdmissionPipeline {
    private final List<Detector> detectors;

    public Optional<DetectionVerdict> evaluate(SecurityEvent event) {
        for (Detector detector : detectors) {
            Optional<DetectionVerdict> verdict;
            try {
                verdict = detector.detect(event);
            } catch (Exception e) {
                log.error("Detector failed, treating as pass: detector={} ip={} path={}",
                        detector.name(), event.getIp(), event.getPath(), e);
                continue;
            }
            if (verdict.isPresent()) {
                DetectionVerdict v = verdict.get();
                log.warn("Request denied: detector={} code={} status={} ip={} path={}",
                        detector.name(), v.getCode(), v.getStatus(), event.getIp(), event.getPath());
                return verdict;
            }
        }
        log.debug("Request admitted: ip={} path={}", event.getIp(), event.getPath());
        return Optional.empty();
    }
}
