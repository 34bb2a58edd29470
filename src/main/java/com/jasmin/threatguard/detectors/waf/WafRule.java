package com.jasmin.threatguard.detectors.waf;

import com.jasmin.threatguard.models.Severity;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A firewall rule as plain data: one pattern, one action. Loaded from {@code waf-rules.yml}.
 */
@Data
@NoArgsConstructor
public class WafRule {
    private String id;
    private String name;
    private String description;
    private RuleCategory category;
    private String pattern;
    private Severity severity;
    private RuleAction action;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private transient Pattern compiled;

    public static WafRule of(String id, RuleCategory category, String pattern, Severity severity, RuleAction action) {
        WafRule rule = new WafRule();
        rule.setId(id);
        rule.setName(id);
        rule.setDescription(id);
        rule.setCategory(category);
        rule.setPattern(pattern);
        rule.setSeverity(severity);
        rule.setAction(action);
        return rule;
    }

    public Pattern compiledPattern() {
        if (compiled == null) {
            compiled = Pattern.compile(pattern);
        }
        return compiled;
    }

    public boolean matches(String input) {
        return input != null && !input.isEmpty() && compiledPattern().matcher(input).find();
    }

    public boolean isBlocking() {
        return action == RuleAction.BLOCK;
    }

    void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalStateException("WAF rule without id");
        }
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalStateException("WAF rule " + id + " has no pattern");
        }
        if (category == null || severity == null || action == null) {
            throw new IllegalStateException("WAF rule " + id + " needs category, severity and action");
        }
        try {
            compiledPattern();
        } catch (PatternSyntaxException e) {
            throw new IllegalStateException("WAF rule " + id + " has an invalid pattern", e);
        }
    }
}
