package com.jasmin.threatguard.controllers.dto;

import lombok.Data;

/** Body of the rotation and strength endpoints; each uses the field it needs. */
@Data
public class SecretRequest {
    private String reason;
    private String secret;
}
