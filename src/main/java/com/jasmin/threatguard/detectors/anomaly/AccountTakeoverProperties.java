package com.jasmin.threatguard.detectors.anomaly;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "detectors.account-takeover")
public class AccountTakeoverProperties {
    private boolean enabled = true;

    private int ipChangeWeight = 30;
    private int userAgentChangeWeight = 20;
    private int rapidSwitchWeight = 50;
    private long rapidSwitchSeconds = 60;

    // Suspicious when either holds
    private int suspiciousScore = 70;
    private int suspiciousFactorCount = 2;
}
