package com.jasmin.threatguard.controllers.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class BlockIpRequest {
    @NotBlank
    private String ip;

    private String reason;

    // Ignored when permanent; null means the default block duration
    @Positive
    private Long durationSeconds;

    private boolean permanent;
}
