package com.jasmin.threatguard.services.secrets;

import lombok.Getter;

@Getter
public class SecretRotationException extends SecretsException {
    private final SecretType secretType;

    public SecretRotationException(SecretType secretType, Throwable cause) {
        super("Failed to rotate " + secretType.value(), cause);
        this.secretType = secretType;
    }
}
