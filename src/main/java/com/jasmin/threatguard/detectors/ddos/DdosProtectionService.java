package com.jasmin.threatguard.detectors.ddos;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.DetectorUtils;
import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.services.intrusion.IntrusionPreventionService;
import com.jasmin.threatguard.store.KeyManager;
import com.jasmin.threatguard.store.StateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-IP and global fixed-window counting, the flood heuristics, emergency mode, challenge-response and the
 * adaptive limits derived from the threat score.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DdosProtectionService {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final StateStore store;
    private final IntrusionPreventionService intrusionService;
    private final DdosProperties props;
    private final InstantSource clock;

    /* ------------------------------ Counting ------------------------------ */

    public DdosCheckResult checkForDdos(String ip, String endpoint) {
        Duration window = Duration.ofSeconds(props.getWindowSeconds());
        registerActiveIp(ip);

        long ipCount = store.incrementWithin(KeyManager.ddosIp(ip), window);
        long globalCount = store.incrementWithin(KeyManager.DDOS_GLOBAL, window);

        String reason = null;
        if (ipCount > props.getIpThreshold()) {
            reason = "ip_rate_exceeded";
            if (props.isBlockOnIpThreshold() && ipCount == props.getIpThreshold() + 1L) {
                guarded(() -> intrusionService.blockIP(ip, Constants.REASON_DDOS, props.getIpBlockSeconds()),
                        "block IP over threshold", ip);
            }
        } else if (globalCount > props.getGlobalThreshold()) {
            reason = "global_rate_exceeded";
            guarded(this::enableEmergencyMode, "enable emergency mode", ip);
        } else if (store.getLong(KeyManager.slowConnections(ip)) > props.getSlowConnectionThreshold()) {
            reason = "slow_connections";
        } else if (store.incrementWithin(KeyManager.httpFlood(ip, DetectorUtils.normalizePath(endpoint)),
                Duration.ofSeconds(props.getFloodWindowSeconds())) > props.getFloodThreshold()) {
            reason = "http_flood";
        } else if (store.setSize(KeyManager.DDOS_UNIQUE_IPS) > props.getUniqueIpThreshold()
                && globalCount > props.getGlobalThreshold() * props.getDistributedGlobalRatio()) {
            reason = "distributed_attack";
        }

        long ttl = store.ttlSeconds(KeyManager.ddosIp(ip));
        DdosCheckResult result = DdosCheckResult.builder()
                .detected(reason != null)
                .reason(reason)
                .ipCount(ipCount)
                .ipLimit(props.getIpThreshold())
                .retryAfter(ttl > 0 ? ttl : props.getWindowSeconds())
                .build();

        if (result.isDetected()) {
            recordDdosAttempt(ip, reason);
        }
        return result;
    }

    public void registerActiveIp(String ip) {
        store.addToSet(KeyManager.DDOS_UNIQUE_IPS, ip);
        store.expire(KeyManager.DDOS_UNIQUE_IPS, Duration.ofSeconds(props.getWindowSeconds()));
    }

    private void recordDdosAttempt(String ip, String reason) {
        log.warn("DDoS pattern detected: ip={} reason={}", ip, reason);
        guarded(() -> store.incrementWithin(KeyManager.ddosAttempts(ip), Duration.ofHours(props.getAttemptsTtlHours())),
                "record DDoS attempt", ip);
        guarded(() -> intrusionService.recordRateLimitViolation(ip), "record rate-limit violation", ip);
    }

    public List<CountByKey> getTopAttackers(int limit) {
        List<CountByKey> attackers = new ArrayList<>();
        String prefix = KeyManager.ddosAttempts("");
        for (String key : store.scanKeys(KeyManager.DDOS_ATTEMPTS_PATTERN)) {
            attackers.add(new CountByKey(key.substring(prefix.length()), store.getLong(key), 0));
        }
        return attackers.stream()
                .sorted(Comparator.comparingLong(CountByKey::getCount).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    /* ------------------------------ Emergency mode ------------------------------ */

    public boolean isEmergencyMode() {
        return store.exists(KeyManager.DDOS_EMERGENCY_MODE);
    }

    public void enableEmergencyMode() {
        if (store.setIfAbsent(KeyManager.DDOS_EMERGENCY_MODE, clock.instant().toString(),
                Duration.ofSeconds(props.getEmergencyModeSeconds()))) {
            log.error("Emergency mode enabled for {}s", props.getEmergencyModeSeconds());
        }
    }

    public void disableEmergencyMode() {
        if (store.delete(KeyManager.DDOS_EMERGENCY_MODE)) {
            log.info("Emergency mode disabled");
        }
    }

    public boolean isCriticalEndpoint(String path) {
        return path != null && props.getCriticalEndpoints().contains(path);
    }

    public boolean isExempt(String path) {
        return path != null && props.getExemptPaths().contains(path);
    }

    /* ------------------------------ Challenge ------------------------------ */

    public boolean requireChallenge(String ip) {
        return intrusionService.calculateThreatScore(ip).getScore() > props.getChallengeScoreThreshold();
    }

    public boolean requireChallenge(SecurityEvent event) {
        return intrusionService.threatScoreFor(event).getScore() > props.getChallengeScoreThreshold();
    }

    /** Issues a fresh single-use token, replacing any outstanding one for the IP. */
    public String generateChallenge(String ip) {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        StringBuilder token = new StringBuilder(32);
        for (byte b : bytes) token.append(String.format("%02x", b));
        store.set(KeyManager.challenge(ip), token.toString(), Duration.ofSeconds(props.getChallengeTtlSeconds()));
        return token.toString();
    }

    /**
     * Exact-match verification. A correct answer consumes the token and grants a short pass.
     */
    public boolean verifyChallenge(String ip, String response) {
        if (response == null || response.isBlank()) {
            return false;
        }
        String expected = store.get(KeyManager.challenge(ip)).orElse(null);
        if (expected == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), response.trim().getBytes(StandardCharsets.UTF_8))) {
            return false;
        }
        store.delete(KeyManager.challenge(ip));
        store.set(KeyManager.challengePassed(ip), "1", Duration.ofSeconds(props.getChallengePassSeconds()));
        return true;
    }

    public boolean hasPassedChallenge(String ip) {
        return store.exists(KeyManager.challengePassed(ip));
    }

    /* ------------------------------ Adaptive limits ------------------------------ */

    public AdaptiveRateLimit getAdaptiveRateLimit(String ip) {
        int score = intrusionService.calculateThreatScore(ip).getScore();
        DdosProperties.AdaptiveTier tier = props.getBaseTier();
        if (score > props.getHighTier().getMinScore()) {
            tier = props.getHighTier();
        } else if (score > props.getElevatedTier().getMinScore()) {
            tier = props.getElevatedTier();
        }
        int maxRequests = tier.getMaxRequests();
        if (store.exists(KeyManager.DDOS_TIGHT_LIMITS)) {
            maxRequests = Math.max(1, maxRequests / 2);
        }
        return new AdaptiveRateLimit(maxRequests, tier.getBlockSeconds());
    }

    /* ------------------------------ Metrics and reconciliation ------------------------------ */

    public DdosMetrics getMetrics() {
        long global = store.getLong(KeyManager.DDOS_GLOBAL);
        long unique = store.setSize(KeyManager.DDOS_UNIQUE_IPS);
        return DdosMetrics.builder()
                .requestsPerMinute(global)
                .uniqueIps(unique)
                .threatLevel(threatLevel(global, unique))
                .emergencyMode(isEmergencyMode())
                .tightLimits(store.exists(KeyManager.DDOS_TIGHT_LIMITS))
                .timestamp(clock.instant())
                .build();
    }

    ThreatLevel threatLevel(long globalCount, long uniqueIps) {
        double threshold = props.getGlobalThreshold();
        if (globalCount > threshold) return ThreatLevel.CRITICAL;
        if (globalCount > threshold * 0.8) return ThreatLevel.HIGH;
        if (globalCount > threshold * 0.5) return ThreatLevel.MEDIUM;
        if (uniqueIps > 500) return ThreatLevel.LOW;
        return ThreatLevel.NONE;
    }

    /**
     * Raises or lowers emergency mode and the tight-limits flag from the aggregate metrics.
     */
    public ThreatLevel autoScale() {
        DdosMetrics metrics = getMetrics();
        switch (metrics.getThreatLevel()) {
            case CRITICAL:
                enableEmergencyMode();
                break;
            case HIGH:
                if (store.setIfAbsent(KeyManager.DDOS_TIGHT_LIMITS, "1", Duration.ofSeconds(props.getTightLimitsSeconds()))) {
                    log.warn("Tight rate limits enabled for {}s", props.getTightLimitsSeconds());
                }
                break;
            case MEDIUM:
                break;
            default:
                disableEmergencyMode();
                store.delete(KeyManager.DDOS_TIGHT_LIMITS);
                break;
        }
        return metrics.getThreatLevel();
    }

    /* ------------------------------ Geo blocking ------------------------------ */

    public void blockCountry(String countryCode, Long durationSeconds) {
        store.set(KeyManager.geoBlock(countryCode), "1", durationSeconds == null ? null : Duration.ofSeconds(durationSeconds));
        log.warn("Country blocked: country={} durationSeconds={}", countryCode, durationSeconds);
    }

    public void unblockCountry(String countryCode) {
        store.delete(KeyManager.geoBlock(countryCode));
        log.info("Country unblocked: country={}", countryCode);
    }

    public boolean isCountryBlocked(String countryCode) {
        return countryCode != null && !countryCode.isBlank() && store.exists(KeyManager.geoBlock(countryCode));
    }

    private void guarded(Runnable action, String what, String ip) {
        try {
            action.run();
        } catch (Exception e) {
            log.error("Failed to {}: ip={}", what, ip, e);
        }
    }
}
