package com.jasmin.threatguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class AnomalyResult {
    private int score;
    private List<String> anomalies;
    private RiskLevel riskLevel;
    private boolean shouldBlock;

    public static AnomalyResult none() {
        return new AnomalyResult(0, List.of(), RiskLevel.LOW, false);
    }
}
