package com.jasmin.threatguard.detectors.intrusion;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "detectors.injection")
public class InjectionProperties {
    private boolean enabled = true;

    // Header values scanned in addition to path, query and body
    private List<String> scannedHeaders = new ArrayList<>(List.of("referer", "user-agent"));
}
