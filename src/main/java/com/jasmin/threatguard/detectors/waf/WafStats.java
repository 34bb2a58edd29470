package com.jasmin.threatguard.detectors.waf;

import com.jasmin.threatguard.models.CountByKey;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class WafStats {
    private int hours;
    private long totalViolations;

    // key = rule id, uniqueIps = distinct offending IPs
    private List<CountByKey> topRules;
}
