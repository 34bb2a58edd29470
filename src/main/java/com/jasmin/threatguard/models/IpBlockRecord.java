package com.jasmin.threatguard.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class IpBlockRecord {
    private String ip;
    private String reason;
    private Instant blockedUntil;
    private boolean permanent;
    private Instant createdAt;

    public boolean isActive(Instant now) {
        return permanent || (blockedUntil != null && blockedUntil.isAfter(now));
    }
}
