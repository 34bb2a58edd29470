package com.jasmin.threatguard.controllers.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class IncidentStatusRequest {
    @NotBlank
    private String status;
    private String notes;
}
