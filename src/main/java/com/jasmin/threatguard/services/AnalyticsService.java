package com.jasmin.threatguard.services;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.DetectorUtils;
import com.jasmin.threatguard.models.DecisionStats;
import com.jasmin.threatguard.store.KeyManager;
import com.jasmin.threatguard.store.StateStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class AnalyticsService {
    static final List<String> VERDICT_CODES = List.of(
            Constants.IP_BLOCKED, Constants.EMERGENCY_MODE, Constants.GEO_BLOCKED, Constants.DDOS_DETECTED,
            Constants.CHALLENGE_REQUIRED, Constants.INVALID_CHALLENGE, Constants.WAF_BLOCKED,
            Constants.SQL_INJECTION, Constants.XSS, Constants.PATH_TRAVERSAL, Constants.COMMAND_INJECTION,
            Constants.LDAP_INJECTION, Constants.BOT_DETECTED, Constants.HIGH_THREAT_SCORE,
            Constants.CREDENTIAL_STUFFING_DETECTED, Constants.ANOMALY_DETECTED, Constants.ACCOUNT_TAKEOVER_SUSPECTED);

    // Counters live for 40 days, a longer range only adds empty minutes
    static final Duration MAX_RANGE = Duration.ofDays(40);

    private final StateStore store;

    /**
     * Sums the per-minute decision counters over {@code [from, to]}, both ends inclusive, in UTC minutes.
     */
    public DecisionStats getDecisionStats(LocalDateTime from, LocalDateTime to) {
        if (from == null || to == null || to.isBefore(from)) {
            throw new IllegalArgumentException("'from' must not be after 'to'");
        }
        if (Duration.between(from, to).compareTo(MAX_RANGE) > 0) {
            throw new IllegalArgumentException("Range must not exceed " + MAX_RANGE.toDays() + " days");
        }

        List<String> eventKeys = new ArrayList<>();
        List<String> threatKeys = new ArrayList<>();
        Map<String, List<String>> codeKeys = new LinkedHashMap<>();
        for (String code : VERDICT_CODES) {
            codeKeys.put(code, new ArrayList<>());
        }

        for (LocalDateTime dt = from; !dt.isAfter(to); dt = dt.plusMinutes(1)) {
            String minuteKey = DetectorUtils.minuteKey(dt);
            eventKeys.add(KeyManager.getEventsKey(minuteKey));
            threatKeys.add(KeyManager.getThreatsKey(minuteKey));
            for (String code : VERDICT_CODES) {
                codeKeys.get(code).add(KeyManager.getThreatTypeKey(code, minuteKey));
            }
        }

        Map<String, Long> deniedByCode = new LinkedHashMap<>();
        codeKeys.forEach((code, keys) -> {
            long sum = store.sum(keys);
            if (sum > 0) deniedByCode.put(code, sum);
        });

        return new DecisionStats(store.sum(eventKeys), store.sum(threatKeys), from, to, deniedByCode);
    }
}
