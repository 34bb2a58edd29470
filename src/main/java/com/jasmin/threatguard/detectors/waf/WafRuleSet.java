package com.jasmin.threatguard.detectors.waf;

import lombok.Data;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Root of the rules YAML document. */
@Data
public class WafRuleSet {
    private List<WafRule> rules = new ArrayList<>();

    public void validate() {
        Set<String> ids = new HashSet<>();
        for (WafRule rule : rules) {
            rule.validate();
            if (!ids.add(rule.getId())) {
                throw new IllegalStateException("Duplicate WAF rule id: " + rule.getId());
            }
        }
    }
}
