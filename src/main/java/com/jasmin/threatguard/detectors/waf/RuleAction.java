package com.jasmin.threatguard.detectors.waf;

import java.util.Locale;

public enum RuleAction {
    LOG, BLOCK;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
