package com.jasmin.threatguard.detectors.bot;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.bot")
public class BotProperties {
    private boolean enabled = true;

    // Case-insensitive substrings of the User-Agent
    private List<String> userAgentPatterns = new ArrayList<>(List.of(
            "bot", "crawler", "spider", "scraper", "curl", "wget", "python-requests", "java"));

    /** Two requests from one IP closer than this are treated as automated. */
    @Positive
    private long minIntervalMillis = 100;
}
