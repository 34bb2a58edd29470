package com.jasmin.threatguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class DecisionStats {
    private long totalRequests;
    private long totalDenied;
    private LocalDateTime from;
    private LocalDateTime to;
    private Map<String, Long> deniedByCode;
}
