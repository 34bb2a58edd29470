package com.jasmin.threatguard.controllers;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Request attributes the authentication layer sets for a logged-in user, and the roles allowed to use the
 * operator API.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "operator")
public class OperatorProperties {
    @NotBlank
    private String userAttribute = "userId";
    @NotBlank
    private String roleAttribute = "userRole";
    private Set<String> adminRoles = new LinkedHashSet<>(List.of("admin"));
}
