package com.jasmin.threatguard.models;

public enum ThreatBand {
    NORMAL, ELEVATED, BLOCKED
}
