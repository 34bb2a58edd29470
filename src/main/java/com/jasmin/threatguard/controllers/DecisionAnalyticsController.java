package com.jasmin.threatguard.controllers;

import com.jasmin.threatguard.models.DecisionStats;
import com.jasmin.threatguard.services.AnalyticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/security/analytics")
public class DecisionAnalyticsController {
    private final AnalyticsService analyticsService;

    // UTC minutes, both ends inclusive
    @GetMapping("/decisions")
    public DecisionStats getDecisionStats(@RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
                                                   @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        return analyticsService.getDecisionStats(from, to);
    }
}
