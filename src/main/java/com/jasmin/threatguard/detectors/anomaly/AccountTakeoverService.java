package com.jasmin.threatguard.detectors.anomaly;

import com.jasmin.threatguard.models.SessionInfo;
import com.jasmin.threatguard.models.UserBehaviorProfile;
import com.jasmin.threatguard.repositories.BehaviorProfileRepository;
import com.jasmin.threatguard.repositories.SessionRepository;
import com.jasmin.threatguard.services.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
@RequiredArgsConstructor
@Slf4j
public class AccountTakeoverService {

    private final SessionRepository sessionRepository;
    private final BehaviorProfileRepository profileRepository;
    private final AuditService auditService;
    private final AccountTakeoverProperties props;
    private final InstantSource clock;

    /**
     * Compares the request with the user's most recent other session. An IP or user agent change only counts
     * when the new value is not part of the user's behavior profile, so that a user's own devices do not log each
     * other out. Suspicious requests terminate all of the user's sessions so that the next request has to log in
     * again.
     */
    public TakeoverAssessment assess(String userId, String sessionId, String ip, String userAgent) {
        SessionInfo previous = sessionRepository.findLatestExcluding(userId, sessionId).orElse(null);
        if (previous == null) {
            return TakeoverAssessment.clean();
        }

        boolean ipChanged = previous.getIpAddress() != null && !Objects.equals(previous.getIpAddress(), ip);
        boolean agentChanged = previous.getUserAgent() != null && !Objects.equals(previous.getUserAgent(), userAgent);
        UserBehaviorProfile profile = ipChanged || agentChanged ? findProfile(userId) : null;

        int score = 0;
        List<String> factors = new ArrayList<>();
        if (ipChanged && !isKnown(profile == null ? null : profile.getCommonIps(), ip)) {
            score += props.getIpChangeWeight();
            factors.add("ip_change");
        }
        if (agentChanged && !isKnown(profile == null ? null : profile.getCommonUserAgents(), userAgent)) {
            score += props.getUserAgentChangeWeight();
            factors.add("user_agent_change");
        }
        Instant last = previous.getLastActivity() != null ? previous.getLastActivity() : previous.getCreatedAt();
        if (last != null && Duration.between(last, clock.instant()).getSeconds() < props.getRapidSwitchSeconds()) {
            score += props.getRapidSwitchWeight();
            factors.add("rapid_session_switch");
        }

        boolean suspicious = score >= props.getSuspiciousScore() || factors.size() >= props.getSuspiciousFactorCount();
        TakeoverAssessment assessment = new TakeoverAssessment(score, factors, suspicious);
        if (suspicious) {
            forceReauthentication(userId, ip, assessment);
        }
        return assessment;
    }

    // A missing or unreadable profile leaves every new value unknown
    private UserBehaviorProfile findProfile(String userId) {
        try {
            return profileRepository.findByUserId(userId).orElse(null);
        } catch (Exception e) {
            log.error("Failed to load behavior profile: userId={}", userId, e);
            return null;
        }
    }

    private static boolean isKnown(List<String> seen, String value) {
        return value != null && seen != null && seen.contains(value);
    }

    private void forceReauthentication(String userId, String ip, TakeoverAssessment assessment) {
        log.warn("Account takeover suspected: userId={} ip={} score={} factors={}",
                userId, ip, assessment.getScore(), assessment.getFactors());
        try {
            int terminated = sessionRepository.deleteAllForUser(userId);
            auditService.record("account_takeover_suspected", userId, ip,
                    Map.of("score", assessment.getScore(), "factors", assessment.getFactors(), "sessionsTerminated", terminated));
        } catch (Exception e) {
            log.error("Failed to terminate sessions after takeover suspicion: userId={}", userId, e);
        }
    }
}
