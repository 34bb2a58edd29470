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
public class SecretRotationRecord {
    private String secretType;
    private Instant rotatedAt;
    private String rotatedBy;
    private String oldSecretHash;
    private String newSecretHash;
    private String reason;
}
