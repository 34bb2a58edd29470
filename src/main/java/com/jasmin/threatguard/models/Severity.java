package com.jasmin.threatguard.models;

import java.util.Locale;

public enum Severity {
    LOW, MEDIUM, HIGH, CRITICAL;

    /** Lower-case form stored in the database. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity fromValue(String value) {
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
