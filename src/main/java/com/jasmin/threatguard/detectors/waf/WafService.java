package com.jasmin.threatguard.detectors.waf;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.DetectorUtils;
import com.jasmin.threatguard.extractors.JsonUtils;
import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.models.Severity;
import com.jasmin.threatguard.models.Violation;
import com.jasmin.threatguard.repositories.ViolationRepository;
import com.jasmin.threatguard.services.intrusion.IntrusionPreventionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Evaluates every rule of the table against the path, the filtered query, the body, the headers and the
 * cookies of a request.
 */
@Service
@Slf4j
public class WafService {

    private final WafProperties props;
    private final ViolationRepository violationRepository;
    private final IntrusionPreventionService intrusionService;
    private final InstantSource clock;
    private final List<WafRule> rules;

    public WafService(WafProperties props,
                      ViolationRepository violationRepository,
                      IntrusionPreventionService intrusionService,
                      InstantSource clock) {
        this.props = props;
        this.violationRepository = violationRepository;
        this.intrusionService = intrusionService;
        this.clock = clock;
        this.rules = WafRuleLoader.fromClasspath(props.getRulesResource());
    }

    public List<WafRule> getRules() {
        return rules;
    }

    public boolean isWhitelisted(String path) {
        return path != null && props.getWhitelistedPaths().contains(path);
    }

    /**
     * Returns one violation per matched rule; whitelisted paths return nothing without evaluating any rule.
     */
    public List<Violation> evaluate(SecurityEvent event) {
        if (isWhitelisted(event.getPath())) {
            return List.of();
        }
        Map<String, String> surfaces = surfaces(event);
        String headersSnapshot = surfaces.get("headers");
        String bodySnapshot = JsonUtils.toJsonTruncated(surfaces.get("body"), props.getMaxBodySnapshotChars());
        Instant now = clock.instant();

        List<Violation> violations = new ArrayList<>();
        for (WafRule rule : rules) {
            for (String surface : surfaces.values()) {
                if (rule.matches(surface)) {
                    violations.add(Violation.builder()
                            .ip(event.getIp())
                            .ruleId(rule.getId())
                            .ruleName(rule.getName())
                            .category(rule.getCategory().name())
                            .severity(rule.getSeverity())
                            .action(rule.getAction().value())
                            .description(rule.getDescription())
                            .method(event.getMethod())
                            .path(event.getPath())
                            .headersSnapshot(JsonUtils.toJsonTruncated(headersSnapshot, 2000))
                            .bodySnapshot(bodySnapshot)
                            .userAgent(event.getUserAgent())
                            .timestamp(now)
                            .build());
                    break;
                }
            }
        }
        return violations;
    }

    /**
     * Evaluates, persists every match and requests an IP block on a critical one. Persistence and blocking
     * failures are logged and do not change the outcome.
     */
    public WafResult inspect(SecurityEvent event) {
        List<Violation> violations = evaluate(event);
        if (violations.isEmpty()) {
            return WafResult.clean();
        }

        Violation blocking = null;
        boolean critical = false;
        for (Violation v : violations) {
            persist(v);
            if (blocking == null && RuleAction.BLOCK.value().equals(v.getAction())) {
                blocking = v;
            }
            critical |= v.getSeverity() == Severity.CRITICAL;
        }

        if (critical) {
            try {
                intrusionService.blockIP(event.getIp(), Constants.REASON_WAF_CRITICAL, props.getCriticalBlockSeconds());
            } catch (Exception e) {
                log.error("Failed to block IP after critical WAF violation: ip={}", event.getIp(), e);
            }
        }
        return new WafResult(violations, blocking);
    }

    public WafStats getStats(int hours) {
        Instant since = clock.instant().minus(Duration.ofHours(hours));
        return new WafStats(hours, violationRepository.countSince(since), violationRepository.topRulesSince(since, 20));
    }

    public List<CountByKey> getTopBlockedIps(int hours, int limit) {
        Instant since = clock.instant().minus(Duration.ofHours(hours));
        return violationRepository.topIpsSince(since, limit);
    }

    private void persist(Violation v) {
        log.warn("WAF violation: ip={} rule={} severity={} action={} path={}",
                v.getIp(), v.getRuleId(), v.getSeverity(), v.getAction(), v.getPath());
        try {
            violationRepository.save(v);
        } catch (Exception e) {
            log.error("Failed to persist WAF violation: ip={} rule={}", v.getIp(), v.getRuleId(), e);
        }
    }

    private Map<String, String> surfaces(SecurityEvent e) {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("path", e.getPath());

        if (e.getQueryParams() != null) {
            Map<String, List<String>> filtered = new TreeMap<>();
            e.getQueryParams().forEach((k, v) -> {
                if (!props.getSafeQueryParams().contains(k)) filtered.put(k, v);
            });
            if (!filtered.isEmpty()) out.put("query", JsonUtils.toJson(filtered));
        }

        String body = bodyText(e);
        if (body != null) out.put("body", body);

        if (e.getHeaders() != null) {
            Map<String, List<String>> headers = new TreeMap<>();
            e.getHeaders().forEach((k, v) -> {
                if (k != null && !props.getExcludedHeaders().contains(k.toLowerCase(Locale.ROOT))) {
                    headers.put(k.toLowerCase(Locale.ROOT), v);
                }
            });
            out.put("headers", JsonUtils.toJson(headers));
        }

        if (e.getCookies() != null && !e.getCookies().isEmpty()) {
            out.put("cookies", JsonUtils.toJson(new TreeMap<>(e.getCookies())));
        }
        return out;
    }

    // JSON bodies are re-serialized so that formatting cannot hide a payload. The filter caps the body size,
    // so the whole body is scanned.
    private String bodyText(SecurityEvent e) {
        byte[] body = e.getBody();
        if (body == null || body.length == 0) return null;
        Map<String, Object> json = JsonUtils.parseObject(body);
        if (json != null) return JsonUtils.toJson(json);
        return DetectorUtils.withDecodedForm(new String(body, StandardCharsets.UTF_8), e.getContentType());
    }
}
