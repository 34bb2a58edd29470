package com.jasmin.threatguard.extractors;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered lookup rules per request property ({@code client-ip}, {@code user-id}, {@code email},
 * {@code session-id}, {@code user-agent}, {@code country}).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "extractors")
public class ExtractorProperties {
    private Map<String, List<ExtractRule>> rules = new HashMap<>();
}
