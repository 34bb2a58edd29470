package com.jasmin.threatguard.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SecurityIncident {
    private Long id;
    private String type;
    private Severity severity;
    private String title;
    private String description;
    private List<String> affectedUsers;
    private List<String> affectedIps;
    private IncidentStatus status;
    private Instant createdAt;
    private Instant resolvedAt;
    private String resolutionNotes;
}
