package com.jasmin.threatguard.detectors.anomaly;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.anomaly")
public class AnomalyProperties {
    private boolean enabled = true;

    // Profile
    @Positive
    private int profileDays = 7;
    @Positive
    private int commonIpLimit = 5;
    @Positive
    private int commonUserAgentLimit = 3;
    /** A user agent is familiar when it contains the first characters of a common one. */
    @Positive
    private int userAgentPrefixLength = 20;
    /** Zone of the typical login hours. */
    private String zone = "UTC";

    // Per-user counters
    @Positive
    private int userRequestTtlDays = 8;
    @Positive
    private int sensitiveAccessTtlMinutes = 60;

    private List<String> sensitivePrefixes = new ArrayList<>(List.of(
            "/admin", "/api/users", "/api/api-keys", "/api/sessions", "/api/audit"));

    @Valid
    private Weights weights = new Weights();

    /** Scores at or above this block the request and lock the account. */
    private int blockScore = 70;

    @Data
    public static class Weights {
        private int unknownIp = 20;
        private int unfamiliarUserAgent = 15;
        private int unusualHour = 10;

        private int excessiveRequests = 25;
        private double excessiveRequestsMultiplier = 3.0;

        private int failedLogins = 30;
        private int failedLoginThreshold = 3;
        @Positive
        private int failedLoginWindowMinutes = 30;

        private int multipleIps = 20;
        private int multipleIpThreshold = 3;

        private int sensitiveEndpoint = 15;
        private int sensitiveAccessThreshold = 5;
    }
}
