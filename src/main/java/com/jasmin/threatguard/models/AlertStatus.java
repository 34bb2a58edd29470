package com.jasmin.threatguard.models;

import java.util.Locale;
import java.util.Set;

public enum AlertStatus {
    NEW, ACKNOWLEDGED, RESOLVED, IGNORED;

    public boolean canTransitionTo(AlertStatus next) {
        switch (this) {
            case NEW:
                return Set.of(ACKNOWLEDGED, RESOLVED, IGNORED).contains(next);
            case ACKNOWLEDGED:
                return next == RESOLVED;
            default:
                return false;
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlertStatus fromValue(String value) {
        return AlertStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
