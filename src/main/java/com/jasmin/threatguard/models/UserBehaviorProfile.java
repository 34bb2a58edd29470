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
public class UserBehaviorProfile {
    private String userId;
    private double avgRequestsPerHour;
    private List<String> commonIps;
    private List<String> commonUserAgents;
    private List<Integer> typicalLoginHours;
    private Instant updatedAt;
}
