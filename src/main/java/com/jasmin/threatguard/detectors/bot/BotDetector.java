package com.jasmin.threatguard.detectors.bot;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.Detector;
import com.jasmin.threatguard.detectors.DetectorUtils;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.store.KeyManager;
import com.jasmin.threatguard.store.StateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.InstantSource;
import java.util.Locale;
import java.util.Optional;

@Component
@Order(70)
@RequiredArgsConstructor
@Slf4j
public class BotDetector implements Detector {

    private final StateStore store;
    private final BotProperties props;
    private final InstantSource clock;

    @Override
    public Optional<DetectionVerdict> detect(SecurityEvent event) {
        if (!props.isEnabled()) return Optional.empty();

        if (isBot(event.getUserAgent()) || isTooFast(event.getIp())) {
            log.warn("Bot detected: ip={} userAgent={}", event.getIp(), event.getUserAgent());
            return Optional.of(DetectionVerdict.deny(403, Constants.BOT_DETECTED, "Automated traffic is not allowed"));
        }
        return Optional.empty();
    }

    public boolean isBot(String userAgent) {
        String ua = DetectorUtils.safeLower(userAgent);
        if (ua.isEmpty()) return false;
        for (String pattern : props.getUserAgentPatterns()) {
            if (ua.contains(pattern.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    // Keeps the last request time per IP for at least one second
    private boolean isTooFast(String ip) {
        String key = KeyManager.botLastRequest(ip);
        long now = clock.millis();
        long last = store.getLong(key);
        store.set(key, Long.toString(now), Duration.ofMillis(Math.max(1000, props.getMinIntervalMillis())));
        return last > 0 && now - last < props.getMinIntervalMillis();
    }
}
