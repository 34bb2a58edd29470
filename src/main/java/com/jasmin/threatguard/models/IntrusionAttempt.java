package com.jasmin.threatguard.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class IntrusionAttempt {
    private String ip;
    private String userId;
    private String type;
    private Severity severity;
    private String details;
    private String userAgent;
    private String path;
    private Instant timestamp;
}
