package com.jasmin.threatguard.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Read-only view of an identity-layer session row. */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SessionInfo {
    private String sessionId;
    private String userId;
    private String ipAddress;
    private String userAgent;
    private Instant createdAt;
    private Instant lastActivity;
}
