package com.jasmin.threatguard.detectors.anomaly;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.credential-stuffing")
public class CredentialStuffingProperties {
    private boolean enabled = true;

    private List<String> loginPaths = new ArrayList<>(List.of("/api/auth/login", "/api/v1/auth/login"));

    // Window starts at the first attempt from the IP
    @Positive
    private long windowSeconds = 300;

    /** More distinct emails than this within the window blocks the IP. */
    @Positive
    private int maxDistinctEmails = 10;

    @Positive
    private long blockSeconds = 3600;
}
