package com.jasmin.threatguard.detectors.ddos;

public enum ThreatLevel {
    NONE, LOW, MEDIUM, HIGH, CRITICAL
}
