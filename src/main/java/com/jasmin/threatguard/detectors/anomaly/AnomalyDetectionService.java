package com.jasmin.threatguard.detectors.anomaly;

import com.jasmin.threatguard.detectors.DetectorUtils;
import com.jasmin.threatguard.models.AnomalyDetection;
import com.jasmin.threatguard.models.AnomalyResult;
import com.jasmin.threatguard.models.RiskLevel;
import com.jasmin.threatguard.models.SessionInfo;
import com.jasmin.threatguard.models.UserBehaviorProfile;
import com.jasmin.threatguard.repositories.AccountRepository;
import com.jasmin.threatguard.repositories.AnomalyRepository;
import com.jasmin.threatguard.repositories.BehaviorProfileRepository;
import com.jasmin.threatguard.repositories.LoginAttemptRepository;
import com.jasmin.threatguard.repositories.SessionRepository;
import com.jasmin.threatguard.services.AuditService;
import com.jasmin.threatguard.store.KeyManager;
import com.jasmin.threatguard.store.StateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-user behavior baselines and the weighted anomaly score of an authenticated request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyDetectionService {

    private static final int HOURS_PER_DAY = 24;

    private final StateStore store;
    private final BehaviorProfileRepository profileRepository;
    private final AnomalyRepository anomalyRepository;
    private final SessionRepository sessionRepository;
    private final LoginAttemptRepository loginAttemptRepository;
    private final AccountRepository accountRepository;
    private final AuditService auditService;
    private final AnomalyProperties props;
    private final InstantSource clock;

    /* ------------------------------ Profiles ------------------------------ */

    /**
     * Rebuilds the user's baseline from the trailing profile window and stores it, replacing the previous one.
     */
    public UserBehaviorProfile buildProfile(String userId) {
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofDays(props.getProfileDays()));
        List<SessionInfo> sessions = sessionRepository.findByUserSince(userId, since);

        ZoneId zone = ZoneId.of(props.getZone());
        List<Integer> loginHours = loginAttemptRepository.findSuccessfulLoginTimes(userId, since).stream()
                .map(t -> t.atZone(zone).getHour())
                .distinct()
                .sorted()
                .collect(Collectors.toList());

        UserBehaviorProfile profile = UserBehaviorProfile.builder()
                .userId(userId)
                .avgRequestsPerHour(averageRequestsPerHour(userId, now))
                .commonIps(mostFrequent(sessions, SessionInfo::getIpAddress, props.getCommonIpLimit()))
                .commonUserAgents(mostFrequent(sessions, SessionInfo::getUserAgent, props.getCommonUserAgentLimit()))
                .typicalLoginHours(loginHours)
                .updatedAt(now)
                .build();
        profileRepository.upsert(profile);
        log.debug("Behavior profile built: userId={} sessions={}", userId, sessions.size());
        return profile;
    }

    /** Rebuilds the profile of every user with a recent session. Returns the number of profiles rebuilt. */
    public int updateAllProfiles() {
        Instant since = clock.instant().minus(Duration.ofDays(props.getProfileDays()));
        int updated = 0;
        for (String userId : accountRepository.findActiveUserIds(since)) {
            try {
                buildProfile(userId);
                updated++;
            } catch (Exception e) {
                log.error("Failed to rebuild behavior profile: userId={}", userId, e);
            }
        }
        log.info("Behavior profiles rebuilt: count={}", updated);
        return updated;
    }

    private double averageRequestsPerHour(String userId, Instant now) {
        int hours = props.getProfileDays() * HOURS_PER_DAY;
        Instant hour = now.truncatedTo(ChronoUnit.HOURS);
        List<String> keys = new ArrayList<>(hours);
        for (int i = 0; i < hours; i++) {
            keys.add(KeyManager.userRequests(userId, DetectorUtils.hourKey(hour.minus(Duration.ofHours(i)))));
        }
        return (double) store.sum(keys) / hours;
    }

    private static List<String> mostFrequent(List<SessionInfo> sessions, Function<SessionInfo, String> field, int limit) {
        Map<String, Long> counts = sessions.stream()
                .map(field)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    /* ------------------------------ Scoring ------------------------------ */

    /**
     * Counts the request against the user's hourly and sensitive-endpoint counters, then scores it against the
     * stored baseline. A user without a baseline gets one built and scores zero.
     */
    public AnomalyResult detectAnomalies(String userId, String ip, String userAgent, String endpoint) {
        if (userId == null || userId.isBlank()) {
            return AnomalyResult.none();
        }
        Instant now = clock.instant();
        long currentHourRequests = store.incrementWithin(
                KeyManager.userRequests(userId, DetectorUtils.hourKey(now)), Duration.ofDays(props.getUserRequestTtlDays()));
        boolean sensitive = DetectorUtils.matchesAnyPrefix(endpoint, props.getSensitivePrefixes());
        long sensitiveAccesses = sensitive
                ? store.incrementWithin(KeyManager.sensitiveAccess(userId), Duration.ofMinutes(props.getSensitiveAccessTtlMinutes()))
                : 0;

        UserBehaviorProfile profile = profileRepository.findByUserId(userId).orElse(null);
        if (profile == null) {
            buildProfile(userId);
            return AnomalyResult.none();
        }

        AnomalyProperties.Weights w = props.getWeights();
        int score = 0;
        List<String> anomalies = new ArrayList<>();

        if (!isEmpty(profile.getCommonIps()) && ip != null && !profile.getCommonIps().contains(ip)) {
            score += w.getUnknownIp();
            anomalies.add("unknown_ip");
        }
        if (!isEmpty(profile.getCommonUserAgents()) && !isFamiliarUserAgent(userAgent, profile.getCommonUserAgents())) {
            score += w.getUnfamiliarUserAgent();
            anomalies.add("unfamiliar_user_agent");
        }
        int hour = now.atZone(ZoneId.of(props.getZone())).getHour();
        if (!isEmpty(profile.getTypicalLoginHours()) && !profile.getTypicalLoginHours().contains(hour)) {
            score += w.getUnusualHour();
            anomalies.add("unusual_hour");
        }
        if (profile.getAvgRequestsPerHour() > 0
                && currentHourRequests > profile.getAvgRequestsPerHour() * w.getExcessiveRequestsMultiplier()) {
            score += w.getExcessiveRequests();
            anomalies.add("excessive_requests");
        }
        long failedLogins = loginAttemptRepository.countFailedByUserSince(userId,
                now.minus(Duration.ofMinutes(w.getFailedLoginWindowMinutes())));
        if (failedLogins > w.getFailedLoginThreshold()) {
            score += w.getFailedLogins();
            anomalies.add("failed_logins");
        }
        long distinctIps = sessionRepository.countDistinctIpsSince(userId, now.minus(Duration.ofHours(1)));
        if (distinctIps > w.getMultipleIpThreshold()) {
            score += w.getMultipleIps();
            anomalies.add("multiple_ips");
        }
        if (sensitive && sensitiveAccesses > w.getSensitiveAccessThreshold()) {
            score += w.getSensitiveEndpoint();
            anomalies.add("sensitive_endpoint_access");
        }

        RiskLevel risk = RiskLevel.fromScore(score);
        AnomalyResult result = new AnomalyResult(score, anomalies, risk, score >= props.getBlockScore());
        if (!anomalies.isEmpty()) {
            logAnomaly(userId, ip, userAgent, endpoint, result, now);
        }
        if (result.isShouldBlock()) {
            lockAccount(userId, ip, result);
        }
        return result;
    }

    private boolean isFamiliarUserAgent(String userAgent, List<String> common) {
        if (userAgent == null) return false;
        for (String known : common) {
            if (known == null) continue;
            String prefix = known.substring(0, Math.min(known.length(), props.getUserAgentPrefixLength()));
            if (userAgent.contains(prefix)) return true;
        }
        return false;
    }

    private void logAnomaly(String userId, String ip, String userAgent, String endpoint, AnomalyResult result, Instant now) {
        log.warn("Anomaly detected: userId={} ip={} score={} risk={} anomalies={}",
                userId, ip, result.getScore(), result.getRiskLevel(), result.getAnomalies());
        try {
            anomalyRepository.save(AnomalyDetection.builder()
                    .userId(userId)
                    .ip(ip)
                    .userAgent(userAgent)
                    .endpoint(endpoint)
                    .score(result.getScore())
                    .reasons(result.getAnomalies())
                    .risk(result.getRiskLevel())
                    .detectedAt(now)
                    .build());
        } catch (Exception e) {
            log.error("Failed to record anomaly: userId={}", userId, e);
        }
    }

    // Terminates every session of the user; the identity layer forces a fresh login
    private void lockAccount(String userId, String ip, AnomalyResult result) {
        try {
            accountRepository.lockAccount(userId, "anomaly_score_" + result.getScore(), clock.instant());
            int sessions = sessionRepository.deleteAllForUser(userId);
            auditService.record("account_locked_anomaly", userId, ip,
                    Map.of("score", result.getScore(), "anomalies", result.getAnomalies(), "sessionsTerminated", sessions));
            log.warn("Account locked after anomaly: userId={} score={} sessionsTerminated={}", userId, result.getScore(), sessions);
        } catch (Exception e) {
            log.error("Failed to lock account after anomaly: userId={}", userId, e);
        }
    }

    /* ------------------------------ Operator ------------------------------ */

    public boolean unlockAccount(String userId, String actor) {
        boolean unlocked = accountRepository.unlockAccount(userId);
        if (unlocked) {
            auditService.record("account_unlocked", userId, null, Map.of("actor", actor == null ? "unknown" : actor));
            log.info("Account unlocked: userId={} actor={}", userId, actor);
        }
        return unlocked;
    }

    public AnomalyStats getAnomalyStats(int hours) {
        Instant since = clock.instant().minus(Duration.ofHours(hours));
        return new AnomalyStats(hours,
                anomalyRepository.countSince(since),
                anomalyRepository.countByRiskSince(RiskLevel.CRITICAL, since),
                anomalyRepository.countByRiskSince(since));
    }

    private static boolean isEmpty(List<?> list) {
        return list == null || list.isEmpty();
    }
}
