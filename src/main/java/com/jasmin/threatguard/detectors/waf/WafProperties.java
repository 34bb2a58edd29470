package com.jasmin.threatguard.detectors.waf;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.waf")
public class WafProperties {
    private boolean enabled = true;

    /** Classpath location of the rule table. */
    private String rulesResource = "waf-rules.yml";

    /** Exact paths that skip rule evaluation entirely. */
    private Set<String> whitelistedPaths = new LinkedHashSet<>(List.of(
            "/health",
            "/api/health",
            "/api/v1/health",
            "/metrics",
            "/api/metrics",
            "/api/v1/search",
            "/api/v1/analytics/popular-queries",
            "/api/v1/analytics/click",
            "/api/v1/features/environment",
            "/",
            "/favicon.ico"));

    /** Query parameters with free-form but legitimate values; never scanned. */
    private Set<String> safeQueryParams = new LinkedHashSet<>(List.of(
            "q", "sort", "page", "limit", "minPrice", "maxPrice", "minRating"));

    /** Header names (lower case) left out of the serialized header snapshot. */
    private Set<String> excludedHeaders = new LinkedHashSet<>(List.of(
            "host", "cookie", "referer", "accept", "accept-encoding", "accept-language", "connection",
            "content-length", "content-type", "origin", "authorization", "x-forwarded-for", "x-real-ip",
            "x-forwarded-proto", "x-forwarded-host", "x-forwarded-port", "cf-connecting-ip", "cf-ipcountry",
            "x-challenge-response"));

    @Positive
    private int maxBodySnapshotChars = 1000;

    /** Block duration requested from the intrusion service on a critical match. */
    @Positive
    private long criticalBlockSeconds = 3600;

    @Positive
    private int statsHours = 24;
}
