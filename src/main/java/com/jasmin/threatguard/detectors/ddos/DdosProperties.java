package com.jasmin.threatguard.detectors.ddos;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.ddos")
public class DdosProperties {
    private boolean enabled = true;

    // Fixed-window counters
    @Positive
    private int windowSeconds = 60;
    @Positive
    private int ipThreshold = 1000;
    @Positive
    private int globalThreshold = 50000;

    /** Block an IP as soon as it exceeds its per-window threshold. */
    private boolean blockOnIpThreshold = true;
    @Positive
    private long ipBlockSeconds = 3600;

    // Emergency mode
    @Positive
    private long emergencyModeSeconds = 3600;
    @Positive
    private long emergencyRetryAfterSeconds = 60;
    private List<String> criticalEndpoints = new ArrayList<>(List.of(
            "/api/health", "/api/v1/health", "/api/auth/login", "/api/v1/auth/login"));

    /** Paths that are neither counted nor checked. */
    private List<String> exemptPaths = new ArrayList<>(List.of("/health", "/api/health", "/api/v1/health"));

    // Heuristics
    @Positive
    private int slowConnectionThreshold = 50;
    @Positive
    private int slowConnectionTtlSeconds = 300;
    @Positive
    private int floodWindowSeconds = 10;
    @Positive
    private int floodThreshold = 50;
    @Positive
    private int uniqueIpThreshold = 1000;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double distributedGlobalRatio = 0.8;

    @Positive
    private int attemptsTtlHours = 24;

    // Challenge-response
    private int challengeScoreThreshold = 70;
    @Positive
    private long challengeTtlSeconds = 300;
    @Positive
    private long challengePassSeconds = 300;

    // Adaptive limits
    @Positive
    private long tightLimitsSeconds = 1800;
    private AdaptiveTier baseTier = new AdaptiveTier(0, 100, 300);
    private AdaptiveTier elevatedTier = new AdaptiveTier(50, 20, 1800);
    private AdaptiveTier highTier = new AdaptiveTier(80, 5, 3600);

    private boolean geoBlockingEnabled = true;

    /** Tier that applies once the threat score is strictly above {@code minScore}. */
    @Data
    public static class AdaptiveTier {
        private int minScore;
        private int maxRequests;
        private long blockSeconds;

        public AdaptiveTier() {
        }

        public AdaptiveTier(int minScore, int maxRequests, long blockSeconds) {
            this.minScore = minScore;
            this.maxRequests = maxRequests;
            this.blockSeconds = blockSeconds;
        }
    }
}
