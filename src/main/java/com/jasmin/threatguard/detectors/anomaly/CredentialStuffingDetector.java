package com.jasmin.threatguard.detectors.anomaly;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.Detector;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.services.intrusion.IntrusionPreventionService;
import com.jasmin.threatguard.store.KeyManager;
import com.jasmin.threatguard.store.StateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Counts distinct login emails per IP. Only login paths with an email in the request are considered.
 */
@Component
@Order(90)
@RequiredArgsConstructor
@Slf4j
public class CredentialStuffingDetector implements Detector {

    private final StateStore store;
    private final IntrusionPreventionService intrusionService;
    private final CredentialStuffingProperties props;

    @Override
    public Optional<DetectionVerdict> detect(SecurityEvent event) {
        if (!props.isEnabled() || !props.getLoginPaths().contains(event.getPath())) {
            return Optional.empty();
        }
        String email = event.getEmail();
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }

        String key = KeyManager.credentialStuffingEmails(event.getIp());
        store.addToSet(key, email.trim().toLowerCase(Locale.ROOT));
        long distinct = store.setSize(key);
        if (distinct == 1) {
            store.expire(key, Duration.ofSeconds(props.getWindowSeconds()));
        }
        if (distinct <= props.getMaxDistinctEmails()) {
            return Optional.empty();
        }

        log.warn("Credential stuffing detected: ip={} distinctEmails={}", event.getIp(), distinct);
        try {
            intrusionService.blockIP(event.getIp(), Constants.REASON_CREDENTIAL_STUFFING, props.getBlockSeconds());
        } catch (Exception e) {
            log.error("Failed to block IP after credential stuffing: ip={}", event.getIp(), e);
        }
        return Optional.of(DetectionVerdict.deny(429, Constants.CREDENTIAL_STUFFING_DETECTED,
                "Too many login attempts", props.getBlockSeconds()));
    }
}
