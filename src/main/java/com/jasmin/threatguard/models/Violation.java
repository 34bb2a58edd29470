package com.jasmin.threatguard.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A WAF rule match. Append-only.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class Violation {
    private String ip;
    private String ruleId;
    private String ruleName;
    private String category;
    private Severity severity;
    private String action;
    private String description;
    private String method;
    private String path;
    private String headersSnapshot;
    private String bodySnapshot;
    private String userAgent;
    private Instant timestamp;
}
