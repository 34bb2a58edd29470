package com.jasmin.threatguard.services.secrets;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RotationResult {
    private SecretType secretType;
    private boolean success;

    // Shown to the operator once
    private String newSecret;

    private Instant rotatedAt;
    private String error;
}
