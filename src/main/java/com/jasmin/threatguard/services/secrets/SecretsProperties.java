package com.jasmin.threatguard.services.secrets;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "secrets")
public class SecretsProperties {

    /** AES-256 key as 64 hex characters. Empty means a random key for this process only. */
    private String masterKey = "";

    @Positive
    private int rotationIntervalDays = 90;

    @Min(32)
    private int secretBytes = 64;

    @Min(16)
    private int apiKeyBytes = 32;

    private String apiKeyPrefix = "tg_";

    // Values in use when the process starts; only their hashes are ever recorded
    private Map<SecretType, String> current = new EnumMap<>(SecretType.class);

    /** Minimum strength score of a strong secret. */
    private int strongScore = 70;
}
