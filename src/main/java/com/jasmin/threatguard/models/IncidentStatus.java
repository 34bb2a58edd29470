package com.jasmin.threatguard.models;

import java.util.Locale;
import java.util.Set;

public enum IncidentStatus {
    OPEN, INVESTIGATING, RESOLVED, FALSE_POSITIVE;

    public boolean canTransitionTo(IncidentStatus next) {
        switch (this) {
            case OPEN:
                return Set.of(INVESTIGATING, FALSE_POSITIVE).contains(next);
            case INVESTIGATING:
                return Set.of(RESOLVED, FALSE_POSITIVE).contains(next);
            default:
                return false;
        }
    }

    public boolean isClosed() {
        return this == RESOLVED || this == FALSE_POSITIVE;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IncidentStatus fromValue(String value) {
        return IncidentStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
