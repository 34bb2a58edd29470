package com.jasmin.threatguard.controllers.dto;

import com.jasmin.threatguard.models.Severity;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.List;

@Data
public class CreateIncidentRequest {
    @NotBlank
    private String type;
    private Severity severity;
    @NotBlank
    private String title;
    private String description;
    private List<String> affectedUsers;
    private List<String> affectedIps;
}
