package com.jasmin.threatguard.detectors.waf;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.models.Violation;
import com.jasmin.threatguard.repositories.ViolationRepository;
import com.jasmin.threatguard.services.intrusion.IntrusionPreventionService;
import com.jasmin.threatguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class WafServiceTest {

    @Mock
    private ViolationRepository violationRepository;
    @Mock
    private IntrusionPreventionService intrusionService;

    private WafService wafService;

    @BeforeEach
    void setUp() {
        wafService = new WafService(new WafProperties(), violationRepository, intrusionService,
                MutableClock.at("2025-03-01T10:00:00Z"));
    }

    private static SecurityEvent request(String path, Map<String, List<String>> query, String body) {
        return SecurityEvent.builder()
                .method(body == null ? "GET" : "POST")
                .path(path)
                .ip("203.0.113.7")
                .queryParams(query)
                .headers(Map.of("User-Agent", List.of("Mozilla/5.0")))
                .body(body == null ? null : body.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    @Test
    void whitelistedPathIsNeverEvaluated() {
        SecurityEvent event = request("/api/v1/search", Map.of("id", List.of("1 UNION SELECT password")), null);

        assertThat(wafService.evaluate(event)).isEmpty();
        assertThat(wafService.inspect(event).isBlocked()).isFalse();
        verifyNoInteractions(violationRepository, intrusionService);
    }

    @Test
    void unionSelectInQueryIsBlockedAndTheIpBlocked() {
        SecurityEvent event = request("/api/v1/products", Map.of("id", List.of("1 UNION SELECT password FROM users")), null);

        WafResult result = wafService.inspect(event);

        assertThat(result.isBlocked()).isTrue();
        assertThat(result.getBlockingViolation().getRuleId()).isEqualTo("SQL-001");
        assertThat(result.getBlockingViolation().getCategory()).isEqualTo("SQL_INJECTION");
        verify(violationRepository).save(any(Violation.class));
        verify(intrusionService).blockIP("203.0.113.7", Constants.REASON_WAF_CRITICAL, 3600L);
    }

    @Test
    void safeQueryParametersAreNotScanned() {
        SecurityEvent event = request("/api/v1/products", Map.of("q", List.of("<script>alert(1)</script>")), null);

        assertThat(wafService.evaluate(event)).isEmpty();
    }

    @Test
    void logRuleRecordsWithoutBlocking() {
        SecurityEvent event = request("/api/v1/import", null, "{\"url\":\"http://169.254.169.254/latest\"}");

        WafResult result = wafService.inspect(event);

        assertThat(result.isBlocked()).isFalse();
        assertThat(result.getViolations()).extracting(Violation::getRuleId).contains("SSRF-001");
        verify(violationRepository).save(any(Violation.class));
        verify(intrusionService, never()).blockIP(anyString(), anyString(), anyLong());
    }

    @Test
    void persistenceFailureDoesNotChangeTheVerdict() {
        doThrow(new IllegalStateException("db down")).when(violationRepository).save(any(Violation.class));
        SecurityEvent event = request("/api/v1/comments", null, "{\"text\":\"<script>steal()</script>\"}");

        WafResult result = wafService.inspect(event);

        assertThat(result.isBlocked()).isTrue();
        assertThat(result.getBlockingViolation().getCategory()).isEqualTo("XSS");
    }

    @Test
    void bodySnapshotIsTruncated() {
        String payload = "<script>" + "a".repeat(5000) + "</script>";
        SecurityEvent event = request("/api/v1/comments", null, payload);

        List<Violation> violations = wafService.evaluate(event);

        assertThat(violations).isNotEmpty();
        assertThat(violations.get(0).getBodySnapshot()).hasSizeLessThanOrEqualTo(1000);
    }

    @Test
    void wholeBodyIsScannedRegardlessOfPadding() {
        SecurityEvent event = request("/api/v1/orders", null, "note=" + "a".repeat(70_000) + "&name=x' OR 1=1 --");

        List<Violation> violations = wafService.evaluate(event);

        assertThat(violations).extracting(Violation::getRuleId).contains("SQL-002");
    }
}
