package com.jasmin.threatguard.detectors;

import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;

import java.util.Optional;

/**
 * One stage of the admission pipeline. Stages are ordered with {@link org.springframework.core.annotation.Order}
 * and the first verdict short-circuits the remaining ones.
 */
public interface Detector {
    Optional<DetectionVerdict> detect(SecurityEvent event);

    default String name() {
        return getClass().getSimpleName();
    }
}
