package com.jasmin.threatguard.services.intrusion;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.models.IntrusionAttempt;
import com.jasmin.threatguard.models.IpBlockRecord;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.models.Severity;
import com.jasmin.threatguard.models.ThreatBand;
import com.jasmin.threatguard.models.ThreatScore;
import com.jasmin.threatguard.repositories.IntrusionAttemptRepository;
import com.jasmin.threatguard.repositories.IpBlockRepository;
import com.jasmin.threatguard.repositories.LoginAttemptRepository;
import com.jasmin.threatguard.repositories.ViolationRepository;
import com.jasmin.threatguard.services.AuditService;
import com.jasmin.threatguard.store.KeyManager;
import com.jasmin.threatguard.store.StateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * IP blocks, intrusion records, the stateless injection detectors and the per-IP threat score.
 */
@Service
@Slf4j
public class IntrusionPreventionService {

    private final StateStore store;
    private final IpBlockRepository ipBlockRepository;
    private final IntrusionAttemptRepository intrusionRepository;
    private final ViolationRepository violationRepository;
    private final LoginAttemptRepository loginAttemptRepository;
    private final AuditService auditService;
    private final IntrusionProperties props;
    private final InstantSource clock;
    private final Map<InjectionType, List<Pattern>> patterns;

    public IntrusionPreventionService(StateStore store,
                                      IpBlockRepository ipBlockRepository,
                                      IntrusionAttemptRepository intrusionRepository,
                                      ViolationRepository violationRepository,
                                      LoginAttemptRepository loginAttemptRepository,
                                      AuditService auditService,
                                      IntrusionProperties props,
                                      InstantSource clock) {
        this.store = store;
        this.ipBlockRepository = ipBlockRepository;
        this.intrusionRepository = intrusionRepository;
        this.violationRepository = violationRepository;
        this.loginAttemptRepository = loginAttemptRepository;
        this.auditService = auditService;
        this.props = props;
        this.clock = clock;
        this.patterns = compile(props.getPatterns());
    }

    /* ------------------------------ Blocks ------------------------------ */

    public void blockIP(String ip, String reason) {
        blockIP(ip, reason, null);
    }

    /**
     * Blocks the IP for the given duration, or the default one when {@code durationSeconds} is null.
     * An existing block for the same IP is replaced.
     */
    public void blockIP(String ip, String reason, Long durationSeconds) {
        long seconds = durationSeconds == null ? props.getDefaultBlockSeconds() : durationSeconds;
        if (seconds <= 0) {
            throw new IllegalArgumentException("Block duration must be positive: " + seconds);
        }
        Instant now = clock.instant();
        store.set(KeyManager.blockedIp(ip), reason, Duration.ofSeconds(seconds));
        ipBlockRepository.upsert(IpBlockRecord.builder()
                .ip(ip)
                .reason(reason)
                .blockedUntil(now.plusSeconds(seconds))
                .permanent(false)
                .createdAt(now)
                .build());
        auditService.record("ip_blocked", null, ip, Map.of("reason", reason, "durationSeconds", seconds));
        log.warn("IP blocked: ip={} reason={} durationSeconds={}", ip, reason, seconds);
    }

    public void blockIPPermanently(String ip, String reason) {
        Instant now = clock.instant();
        store.set(KeyManager.blockedIp(ip), reason, null);
        ipBlockRepository.upsert(IpBlockRecord.builder()
                .ip(ip)
                .reason(reason)
                .permanent(true)
                .createdAt(now)
                .build());
        auditService.record("ip_blocked", null, ip, Map.of("reason", reason, "permanent", true));
        log.warn("IP blocked permanently: ip={} reason={}", ip, reason);
    }

    public void unblockIP(String ip) {
        store.delete(KeyManager.blockedIp(ip));
        ipBlockRepository.delete(ip);
        auditService.record("ip_unblocked", null, ip, Map.of());
        log.info("IP unblocked: ip={}", ip);
    }

    public boolean isBlocked(String ip) {
        return store.exists(KeyManager.blockedIp(ip));
    }

    /** Seconds until the block expires; null for permanent or missing blocks. */
    public Long remainingBlockSeconds(String ip) {
        long ttl = store.ttlSeconds(KeyManager.blockedIp(ip));
        return ttl > 0 ? ttl : null;
    }

    public long countActiveBlocks() {
        return ipBlockRepository.countActive(clock.instant());
    }

    public List<IpBlockRecord> listActiveBlocks(int limit) {
        return ipBlockRepository.findActive(clock.instant(), limit);
    }

    /* ------------------------------ Detectors ------------------------------ */

    public boolean detectSqlInjection(String input, String ip) {
        return detect(InjectionType.SQL_INJECTION, input, ip);
    }

    public boolean detectXss(String input, String ip) {
        return detect(InjectionType.XSS, input, ip);
    }

    public boolean detectPathTraversal(String input, String ip) {
        return detect(InjectionType.PATH_TRAVERSAL, input, ip);
    }

    public boolean detectCommandInjection(String input, String ip) {
        return detect(InjectionType.COMMAND_INJECTION, input, ip);
    }

    public boolean detectLdapInjection(String input, String ip) {
        return detect(InjectionType.LDAP_INJECTION, input, ip);
    }

    /** Pure pattern check, no side effects. */
    public boolean matches(InjectionType type, String input) {
        if (input == null || input.isEmpty()) return false;
        for (Pattern p : patterns.get(type)) {
            if (p.matcher(input).find()) return true;
        }
        return false;
    }

    private boolean detect(InjectionType type, String input, String ip) {
        if (!matches(type, input)) return false;
        recordIntrusion(IntrusionAttempt.builder()
                .ip(ip)
                .type(type.name().toLowerCase(Locale.ROOT))
                .severity(type.severity())
                .details(abbreviate(input, 500))
                .timestamp(clock.instant())
                .build());
        return true;
    }

    /** Records a hit found by the pipeline on a request's surfaces. */
    public void recordIntrusion(InjectionType type, String input, SecurityEvent event) {
        recordIntrusion(IntrusionAttempt.builder()
                .ip(event.getIp())
                .userId(event.getUserId())
                .type(type.name().toLowerCase(Locale.ROOT))
                .severity(type.severity())
                .details(abbreviate(input, 500))
                .userAgent(event.getUserAgent())
                .path(event.getPath())
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Persists the attempt; a critical attempt also blocks the IP for a multiple of the default duration.
     * Neither step propagates failures.
     */
    public void recordIntrusion(IntrusionAttempt attempt) {
        if (attempt.getTimestamp() == null) {
            attempt.setTimestamp(clock.instant());
        }
        try {
            intrusionRepository.save(attempt);
        } catch (Exception e) {
            log.error("Failed to record intrusion attempt: ip={} type={}", attempt.getIp(), attempt.getType(), e);
        }
        log.warn("Intrusion attempt: ip={} type={} severity={}", attempt.getIp(), attempt.getType(),
                attempt.getSeverity());

        if (attempt.getSeverity() == Severity.CRITICAL) {
            try {
                blockIP(attempt.getIp(), Constants.REASON_CRITICAL_INTRUSION,
                        props.getDefaultBlockSeconds() * props.getCriticalBlockMultiplier());
            } catch (Exception e) {
                log.error("Failed to block IP after critical intrusion: ip={}", attempt.getIp(), e);
            }
        }
    }

    public IntrusionStats getIntrusionStats(int hours) {
        Instant since = clock.instant().minus(Duration.ofHours(hours));
        return new IntrusionStats(hours,
                intrusionRepository.countSince(since),
                intrusionRepository.countBySeveritySince(Severity.CRITICAL, since),
                intrusionRepository.countByTypeSince(since),
                intrusionRepository.countBySeveritySince(since));
    }

    /* ------------------------------ Threat score ------------------------------ */

    /** Counts a rate-limit denial against the IP for the threat score window. */
    public void recordRateLimitViolation(String ip) {
        store.incrementWithin(KeyManager.rateLimitViolations(ip),
                Duration.ofMinutes(props.getThreatScore().getWindowMinutes()));
    }

    /** Memoized per request. */
    public ThreatScore threatScoreFor(SecurityEvent event) {
        if (event.getThreatScore() == null) {
            event.setThreatScore(calculateThreatScore(event.getIp()));
        }
        return event.getThreatScore();
    }

    public ThreatScore calculateThreatScore(String ip) {
        IntrusionProperties.ThreatScoreWeights w = props.getThreatScore();
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofMinutes(w.getWindowMinutes()));
        Map<String, Double> factors = new LinkedHashMap<>();

        boolean alreadyBlocked = isBlocked(ip);
        if (alreadyBlocked) {
            factors.put("blocked", w.getBlockedWeight());
        }

        double intrusions = decayed(intrusionRepository.findTimestampsByIpSince(ip, since), now, w.getHalfLifeMinutes());
        if (intrusions > 0) {
            factors.put("intrusions", intrusions * w.getIntrusionWeight());
        }

        double violations = decayed(violationRepository.findBlockingTimestampsByIpSince(ip, since), now, w.getHalfLifeMinutes());
        if (violations > 0) {
            factors.put("wafViolations", violations * w.getViolationWeight());
        }

        long failedLogins = loginAttemptRepository.countFailedByIpSince(ip, since);
        if (failedLogins > w.getFailedLoginThreshold()) {
            factors.put("failedLogins", failedLogins * w.getFailedLoginWeight());
        }

        long rateLimitViolations = store.getLong(KeyManager.rateLimitViolations(ip));
        if (rateLimitViolations > w.getRateLimitViolationThreshold()) {
            factors.put("rateLimitViolations", rateLimitViolations * w.getRateLimitViolationWeight());
        }

        double raw = factors.values().stream().mapToDouble(Double::doubleValue).sum();
        int score = (int) Math.min(100, Math.round(raw));
        boolean blocked = raw >= w.getBlockThreshold();
        ThreatBand band = blocked ? ThreatBand.BLOCKED
                : raw >= w.getElevatedThreshold() ? ThreatBand.ELEVATED : ThreatBand.NORMAL;

        if (blocked && w.isAutoBlock() && !alreadyBlocked) {
            try {
                blockIP(ip, Constants.REASON_HIGH_THREAT_SCORE);
            } catch (Exception e) {
                log.error("Failed to block IP with high threat score: ip={}", ip, e);
            }
        }
        return new ThreatScore(ip, score, band, blocked, factors);
    }

    // Each hit counts 0.5^(age / halfLife)
    private static double decayed(List<Instant> hits, Instant now, int halfLifeMinutes) {
        double halfLifeSeconds = halfLifeMinutes * 60.0;
        double sum = 0;
        for (Instant hit : hits) {
            if (hit == null) continue;
            double age = Math.max(0, Duration.between(hit, now).getSeconds());
            sum += Math.pow(0.5, age / halfLifeSeconds);
        }
        return sum;
    }

    private static Map<InjectionType, List<Pattern>> compile(IntrusionProperties.Patterns p) {
        Map<InjectionType, List<String>> raw = new EnumMap<>(InjectionType.class);
        raw.put(InjectionType.SQL_INJECTION, p.getSqlInjection());
        raw.put(InjectionType.XSS, p.getXss());
        raw.put(InjectionType.PATH_TRAVERSAL, p.getPathTraversal());
        raw.put(InjectionType.COMMAND_INJECTION, p.getCommandInjection());
        raw.put(InjectionType.LDAP_INJECTION, p.getLdapInjection());

        Map<InjectionType, List<Pattern>> compiled = new EnumMap<>(InjectionType.class);
        raw.forEach((type, list) -> compiled.put(type,
                list.stream().map(Pattern::compile).collect(Collectors.toList())));
        return compiled;
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
