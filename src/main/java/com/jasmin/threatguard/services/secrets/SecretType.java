package com.jasmin.threatguard.services.secrets;

import java.util.Locale;

public enum SecretType {
    JWT_SECRET, SESSION_SECRET;

    /** Lower-case form stored in the rotation history. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SecretType fromValue(String value) {
        try {
            return SecretType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown secret type: " + value);
        }
    }
}
