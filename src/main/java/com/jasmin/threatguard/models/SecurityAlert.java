package com.jasmin.threatguard.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SecurityAlert {
    private Long id;
    private String type;
    private Severity severity;
    private String title;
    private String description;
    private Map<String, Object> details;
    private AlertStatus status;
    private Instant createdAt;
    private String acknowledgedBy;
    private Instant acknowledgedAt;
    private Instant resolvedAt;
}
