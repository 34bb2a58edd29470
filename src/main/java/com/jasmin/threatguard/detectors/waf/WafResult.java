package com.jasmin.threatguard.detectors.waf;

import com.jasmin.threatguard.models.Violation;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class WafResult {
    private List<Violation> violations;

    // First matched BLOCK rule, null when the request only triggered log rules
    private Violation blockingViolation;

    public boolean isBlocked() {
        return blockingViolation != null;
    }

    public static WafResult clean() {
        return new WafResult(List.of(), null);
    }
}
