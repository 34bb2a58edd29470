package com.jasmin.threatguard.controllers;

import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.services.AnalyticsService;
import com.jasmin.threatguard.services.DecisionCounterService;
import com.jasmin.threatguard.support.InMemoryStateStore;
import com.jasmin.threatguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DecisionAnalyticsControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2025-03-01T10:15:00Z");
        InMemoryStateStore store = new InMemoryStateStore(clock);
        DecisionCounterService counters = new DecisionCounterService(store, clock);

        SecurityEvent admitted = SecurityEvent.builder().ip("192.0.2.1").timestamp(Instant.parse("2025-03-01T10:01:10Z")).build();
        SecurityEvent denied = SecurityEvent.builder().ip("192.0.2.2").timestamp(Instant.parse("2025-03-01T10:02:40Z")).build();
        SecurityEvent outside = SecurityEvent.builder().ip("192.0.2.3").timestamp(Instant.parse("2025-03-01T09:59:59Z")).build();
        counters.record(admitted, null);
        counters.record(denied, DetectionVerdict.deny(403, "WAF_BLOCKED", "blocked"));
        counters.record(denied, DetectionVerdict.deny(429, "DDOS_DETECTED", "slow down", 60L));
        counters.record(outside, DetectionVerdict.deny(403, "BOT_DETECTED", "bot"));

        mockMvc = MockMvcBuilders
                .standaloneSetup(new DecisionAnalyticsController(new AnalyticsService(store)))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void countsWithinTheRangeAreSummedPerCode() throws Exception {
        mockMvc.perform(get("/api/v1/security/analytics/decisions")
                        .param("from", "2025-03-01T10:00:00")
                        .param("to", "2025-03-01T10:10:00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRequests").value(3))
                .andExpect(jsonPath("$.totalDenied").value(2))
                .andExpect(jsonPath("$.deniedByCode.WAF_BLOCKED").value(1))
                .andExpect(jsonPath("$.deniedByCode.DDOS_DETECTED").value(1))
                .andExpect(jsonPath("$.deniedByCode.BOT_DETECTED").doesNotExist());
    }

    @Test
    void reversedRangeIs400() throws Exception {
        mockMvc.perform(get("/api/v1/security/analytics/decisions")
                        .param("from", "2025-03-01T10:10:00")
                        .param("to", "2025-03-01T10:00:00"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void rangeOverFortyDaysIs400() throws Exception {
        mockMvc.perform(get("/api/v1/security/analytics/decisions")
                        .param("from", "2025-01-01T00:00:00")
                        .param("to", "2025-03-01T00:00:00"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void missingOrMalformedParametersAre400() throws Exception {
        mockMvc.perform(get("/api/v1/security/analytics/decisions").param("from", "2025-03-01T10:00:00"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/security/analytics/decisions")
                        .param("from", "yesterday")
                        .param("to", "2025-03-01T10:00:00"))
                .andExpect(status().isBadRequest());
    }
}
