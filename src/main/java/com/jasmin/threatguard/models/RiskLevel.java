package com.jasmin.threatguard.models;

public enum RiskLevel {
    LOW, MEDIUM, HIGH, CRITICAL;

    public static RiskLevel fromScore(int score) {
        if (score >= 70) return CRITICAL;
        if (score >= 50) return HIGH;
        if (score >= 30) return MEDIUM;
        return LOW;
    }
}
