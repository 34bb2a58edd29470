package com.jasmin.threatguard.detectors.ddos;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class DdosCheckResult {
    private boolean detected;

    // ip_rate_exceeded, global_rate_exceeded, slow_connections, http_flood, distributed_attack
    private String reason;

    private long ipCount;
    private int ipLimit;

    // Seconds until the per-IP window resets
    private long retryAfter;
}
