package com.jasmin.threatguard.engine;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private boolean enabled = true;

    // Larger bodies are rejected with 413 before any stage runs
    @Positive
    private int maxBodyBytes = 1_048_576;

    // Path prefixes that bypass the pipeline entirely
    private List<String> excludedPaths = new ArrayList<>();

    public boolean isExcluded(String path) {
        if (path == null) return false;
        for (String prefix : excludedPaths) {
            if (prefix != null && !prefix.isBlank() && path.startsWith(prefix)) return true;
        }
        return false;
    }
}
