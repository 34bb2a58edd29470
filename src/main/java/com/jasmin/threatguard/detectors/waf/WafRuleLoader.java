package com.jasmin.threatguard.detectors.waf;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;

/**
 * Loads the firewall rule table from a classpath YAML resource and fails fast on an invalid rule.
 */
@Slf4j
public final class WafRuleLoader {

    private WafRuleLoader() {
    }

    public static List<WafRule> fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = WafRuleLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static List<WafRule> parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(WafRuleSet.class, options));
        WafRuleSet ruleSet = yaml.load(is);

        if (ruleSet == null || ruleSet.getRules() == null || ruleSet.getRules().isEmpty()) {
            log.warn("No WAF rules defined");
            return List.of();
        }
        ruleSet.validate();
        log.info("Loaded {} WAF rule(s)", ruleSet.getRules().size());
        return List.copyOf(ruleSet.getRules());
    }
}
