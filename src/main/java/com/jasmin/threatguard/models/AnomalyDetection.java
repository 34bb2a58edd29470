package com.jasmin.threatguard.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class AnomalyDetection {
    private String userId;
    private String ip;
    private String userAgent;
    private String endpoint;
    private int score;
    private List<String> reasons;
    private RiskLevel risk;
    private Instant detectedAt;
}
