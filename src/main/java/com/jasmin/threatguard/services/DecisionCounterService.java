package com.jasmin.threatguard.services;

import com.jasmin.threatguard.detectors.DetectorUtils;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.store.KeyManager;
import com.jasmin.threatguard.store.StateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.InstantSource;

/**
 * Per-minute counters of admission decisions: all requests, denied requests and denials per verdict code.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DecisionCounterService {
    static final Duration COUNTER_TTL = Duration.ofDays(40);

    private final StateStore store;
    private final InstantSource clock;

    public void record(SecurityEvent event, DetectionVerdict verdict) {
        try {
            String minuteKey = DetectorUtils.minuteKey(event.getTimestamp() == null ? clock.instant() : event.getTimestamp());
            store.incrementWithin(KeyManager.getEventsKey(minuteKey), COUNTER_TTL);
            if (verdict != null) {
                store.incrementWithin(KeyManager.getThreatsKey(minuteKey), COUNTER_TTL);
                if (verdict.getCode() != null) {
                    store.incrementWithin(KeyManager.getThreatTypeKey(verdict.getCode(), minuteKey), COUNTER_TTL);
                }
            }
        } catch (Exception e) {
            log.error("Failed to record decision counters: ip={}", event.getIp(), e);
        }
    }
}
