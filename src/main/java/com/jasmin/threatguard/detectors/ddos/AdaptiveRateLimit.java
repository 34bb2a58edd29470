package com.jasmin.threatguard.detectors.ddos;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class AdaptiveRateLimit {
    private int maxRequests;
    private long blockDurationSeconds;
}
