package com.jasmin.threatguard.services.intrusion;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "intrusion")
public class IntrusionProperties {

    /** Block duration used when a caller does not pass one. */
    @Positive
    private long defaultBlockSeconds = 3600;

    /** Critical intrusions block for this multiple of the default duration. */
    @Min(1)
    private int criticalBlockMultiplier = 2;

    @Valid
    private ThreatScoreWeights threatScore = new ThreatScoreWeights();

    @Valid
    private Patterns patterns = new Patterns();

    @Data
    public static class ThreatScoreWeights {
        private double blockedWeight = 100;
        private double intrusionWeight = 20;
        private double violationWeight = 10;
        private int failedLoginThreshold = 5;
        private double failedLoginWeight = 5;
        private int rateLimitViolationThreshold = 10;
        private double rateLimitViolationWeight = 2;

        /** Look-back window for intrusion attempts, WAF violations and failed logins. */
        @Positive
        private int windowMinutes = 60;

        /** A hit loses half of its weight every half-life. */
        @Positive
        private int halfLifeMinutes = 30;

        private int blockThreshold = 100;
        private int elevatedThreshold = 50;

        /** Block the IP as soon as its score reaches the block threshold. */
        private boolean autoBlock = true;
    }

    @Data
    public static class Patterns {
        private List<String> sqlInjection = new ArrayList<>(List.of(
                "(?i)\\bunion\\b[\\s\\S]*\\bselect\\b",
                "(?i)'\\s*(or|and)\\s+['\"]?\\w+['\"]?\\s*=\\s*['\"]?\\w+",
                "(?i)\\b(or|and)\\s+(\\d+)\\s*=\\s*\\2\\b",
                "(?i);\\s*(drop|delete|insert|update|alter|truncate)\\s",
                "(?i)'\\s*;?\\s*--",
                "(?i)\\b(sleep|benchmark|pg_sleep)\\s*\\(",
                "(?i)\\bexec(\\s|\\()+(xp_|sp_)"));

        private List<String> xss = new ArrayList<>(List.of(
                "(?i)<script\\b",
                "(?i)javascript\\s*:",
                "(?i)<[^>]+\\bon\\w+\\s*=",
                "(?i)<(iframe|object|embed)\\b"));

        private List<String> pathTraversal = new ArrayList<>(List.of(
                "\\.\\.[/\\\\]",
                "(?i)%2e%2e(%2f|%5c|/|\\\\)",
                "(?i)\\.\\.%2f",
                "(?i)/etc/(passwd|shadow)",
                "(?i)c:\\\\windows"));

        private List<String> commandInjection = new ArrayList<>(List.of(
                "(?i)[;&|`]\\s*(cat|ls|rm|wget|curl|nc|bash|sh|whoami|id|uname|ping|chmod)\\b",
                "\\$\\([^)]*\\)",
                "`[^`]+`"));

        private List<String> ldapInjection = new ArrayList<>(List.of(
                "\\*\\)\\s*\\(",
                "\\)\\s*\\(\\s*[|&!]",
                "\\(\\s*[|&]\\s*\\("));
    }
}
