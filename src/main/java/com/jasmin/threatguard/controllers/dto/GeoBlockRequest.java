package com.jasmin.threatguard.controllers.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class GeoBlockRequest {
    @NotBlank
    @Size(min = 2, max = 2)
    private String country;

    // null blocks until removed
    @Positive
    private Long durationSeconds;
}
