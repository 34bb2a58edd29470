package com.jasmin.threatguard.services.secrets;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RotationStatus {
    private SecretType secretType;
    private Instant lastRotatedAt;
    private boolean rotationNeeded;
}
