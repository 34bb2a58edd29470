package com.jasmin.threatguard.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class SecurityEvent {
    private String method;
    private String path;
    private String remoteAddr;
    private String contentType;

    // All headers: key -> list of values
    private Map<String, List<String>> headers;

    // All query params: key -> list of values
    private Map<String, List<String>> queryParams;

    private Map<String, String> cookies;

    // Raw request body
    private byte[] body;

    private Instant timestamp;

    private String ip;
    private String userId;
    private String email;
    private String sessionId;
    private String userAgent;
    private String country;

    // Computed at most once per request, see IntrusionPreventionService#threatScoreFor
    @JsonIgnore
    private ThreatScore threatScore;

    // Set by the DDoS stage for the informational rate-limit headers
    private Integer rateLimit;
    private Long rateLimitRemaining;

    public boolean isAuthenticated() {
        return userId != null && !userId.isBlank();
    }
}
