package com.jasmin.threatguard.extractors;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One lookup step for a request property. Values longer than {@code maxLength} are cut before they reach
 * detectors or stored records; {@code null} keeps them whole.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractRule {
    private ExtractSource source;
    private String key;
    private Integer maxLength;

    public ExtractRule(ExtractSource source, String key) {
        this(source, key, null);
    }
}
