package com.jasmin.threatguard.engine;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.detectors.ddos.ConnectionTracker;
import com.jasmin.threatguard.detectors.ddos.DdosDetector;
import com.jasmin.threatguard.detectors.ddos.DdosProperties;
import com.jasmin.threatguard.detectors.ddos.DdosProtectionService;
import com.jasmin.threatguard.detectors.intrusion.IpBlockDetector;
import com.jasmin.threatguard.detectors.waf.WafDetector;
import com.jasmin.threatguard.detectors.waf.WafProperties;
import com.jasmin.threatguard.detectors.waf.WafService;
import com.jasmin.threatguard.extractors.ExtractRule;
import com.jasmin.threatguard.extractors.ExtractSource;
import com.jasmin.threatguard.extractors.ExtractUtils;
import com.jasmin.threatguard.extractors.ExtractorProperties;
import com.jasmin.threatguard.models.DecisionStats;
import com.jasmin.threatguard.models.SecurityEvent;
import com.jasmin.threatguard.repositories.IntrusionAttemptRepository;
import com.jasmin.threatguard.repositories.IpBlockRepository;
import com.jasmin.threatguard.repositories.LoginAttemptRepository;
import com.jasmin.threatguard.repositories.ViolationRepository;
import com.jasmin.threatguard.services.AnalyticsService;
import com.jasmin.threatguard.services.AuditService;
import com.jasmin.threatguard.services.DecisionCounterService;
import com.jasmin.threatguard.services.intrusion.IntrusionPreventionService;
import com.jasmin.threatguard.services.intrusion.IntrusionProperties;
import com.jasmin.threatguard.store.KeyManager;
import com.jasmin.threatguard.support.InMemoryStateStore;
import com.jasmin.threatguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AdmissionFilterTest {

    @Mock
    private IpBlockRepository ipBlockRepository;
    @Mock
    private IntrusionAttemptRepository intrusionRepository;
    @Mock
    private ViolationRepository violationRepository;
    @Mock
    private LoginAttemptRepository loginAttemptRepository;
    @Mock
    private AuditService auditService;

    private MutableClock clock;
    private InMemoryStateStore store;
    private IntrusionPreventionService intrusionService;
    private PipelineProperties pipelineProps;
    private MockMvc mockMvc;
    private final List<SecurityEvent> admittedEvents = new ArrayList<>();

    @RestController
    static class ShopController {
        @GetMapping("/api/v1/products")
        String products() {
            return "products";
        }

        @GetMapping("/internal/ping")
        String ping() {
            return "pong";
        }

        @PostMapping("/api/v1/orders")
        String order(@RequestBody String body) {
            return body;
        }
    }

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T10:00:30Z");
        store = new InMemoryStateStore(clock);
        intrusionService = new IntrusionPreventionService(store, ipBlockRepository, intrusionRepository,
                violationRepository, loginAttemptRepository, auditService, new IntrusionProperties(), clock);

        DdosProperties ddosProps = new DdosProperties();
        // every request below hits the same endpoint
        ddosProps.setFloodThreshold(10_000);
        DdosProtectionService ddosService = new DdosProtectionService(store, intrusionService, ddosProps, clock);
        WafProperties wafProps = new WafProperties();
        WafService wafService = new WafService(wafProps, violationRepository, intrusionService, clock);

        AdmissionPipeline pipeline = new AdmissionPipeline(List.of(
                new IpBlockDetector(intrusionService),
                new DdosDetector(ddosService, ddosProps),
                new WafDetector(wafService, wafProps),
                event -> {
                    admittedEvents.add(event);
                    return Optional.empty();
                }));

        ExtractorProperties extractorProps = new ExtractorProperties();
        extractorProps.getRules().put("client-ip", List.of(new ExtractRule(ExtractSource.HEADER, "X-Forwarded-For")));
        extractorProps.getRules().put("email", List.of(new ExtractRule(ExtractSource.BODY_JSON, "email")));
        extractorProps.getRules().put("user-id", List.of(new ExtractRule(ExtractSource.ATTRIBUTE, "userId")));

        pipelineProps = new PipelineProperties();
        pipelineProps.getExcludedPaths().add("/internal/");

        AdmissionFilter filter = new AdmissionFilter(pipeline, new ExtractUtils(extractorProps),
                new ConnectionTracker(store, ddosProps), new DecisionCounterService(store, clock), pipelineProps, clock);
        mockMvc = MockMvcBuilders.standaloneSetup(new ShopController()).addFilters(filter).build();
    }

    private static MockHttpServletRequestBuilder products(String ip) {
        return get("/api/v1/products").header("X-Forwarded-For", ip + ", 10.0.0.1");
    }

    @Test
    void admittedRequestReachesTheHandlerWithRateLimitHeaders() throws Exception {
        mockMvc.perform(products("203.0.113.10"))
                .andExpect(status().isOk())
                .andExpect(content().string("products"))
                .andExpect(header().string(Constants.RATE_LIMIT_LIMIT_HEADER, "1000"))
                .andExpect(header().string(Constants.RATE_LIMIT_REMAINING_HEADER, "999"));
    }

    @Test
    void requestOverTheIpThresholdIsRejectedThenTheIpIsBlocked() throws Exception {
        for (int i = 0; i < 1000; i++) {
            mockMvc.perform(products("203.0.113.11")).andExpect(status().isOk());
        }

        mockMvc.perform(products("203.0.113.11"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "60"))
                .andExpect(jsonPath("$.code").value(Constants.DDOS_DETECTED))
                .andExpect(jsonPath("$.retryAfter").value(60));

        mockMvc.perform(products("203.0.113.11"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value(Constants.IP_BLOCKED));

        // other clients are unaffected
        mockMvc.perform(products("203.0.113.12")).andExpect(status().isOk());
    }

    @Test
    void sqlInjectionInTheQueryIsBlockedByTheWaf() throws Exception {
        mockMvc.perform(products("198.51.100.3").queryParam("id", "1 UNION SELECT password FROM users"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value(Constants.WAF_BLOCKED))
                .andExpect(jsonPath("$.ruleId").value("SQL-001"))
                .andExpect(jsonPath("$.category").value("SQL_INJECTION"));
    }

    @Test
    void blockedIpIsRejectedWithTheRemainingBlockTime() throws Exception {
        intrusionService.blockIP("192.0.2.50", "manual", 600L);

        mockMvc.perform(products("192.0.2.50"))
                .andExpect(status().isForbidden())
                .andExpect(header().string("Retry-After", "600"))
                .andExpect(jsonPath("$.code").value(Constants.IP_BLOCKED));
    }

    @Test
    void excludedPathsBypassThePipeline() throws Exception {
        intrusionService.blockIP("192.0.2.51", "manual", 600L);

        mockMvc.perform(get("/internal/ping").header("X-Forwarded-For", "192.0.2.51"))
                .andExpect(status().isOk())
                .andExpect(content().string("pong"));
    }

    @Test
    void disabledPipelineAdmitsEverything() throws Exception {
        intrusionService.blockIP("192.0.2.52", "manual", 600L);
        pipelineProps.setEnabled(false);

        mockMvc.perform(products("192.0.2.52")).andExpect(status().isOk());
    }

    @Test
    void bodyIsStillReadableByTheHandler() throws Exception {
        String json = "{\"email\":\"buyer@example.com\",\"items\":[1,2]}";

        mockMvc.perform(post("/api/v1/orders").header("X-Forwarded-For", "198.51.100.4")
                        .contentType(MediaType.APPLICATION_JSON).content(json))
                .andExpect(status().isOk())
                .andExpect(content().string(json));
    }

    @Test
    void decisionsAreCountedPerMinute() throws Exception {
        intrusionService.blockIP("192.0.2.53", "manual", 600L);
        mockMvc.perform(products("198.51.100.5")).andExpect(status().isOk());
        mockMvc.perform(products("192.0.2.53")).andExpect(status().isForbidden());
        mockMvc.perform(products("192.0.2.53")).andExpect(status().isForbidden());

        DecisionStats stats = new AnalyticsService(store).getDecisionStats(
                LocalDateTime.parse("2025-03-01T10:00:00"), LocalDateTime.parse("2025-03-01T10:05:00"));

        assertThat(stats.getTotalRequests()).isEqualTo(3);
        assertThat(stats.getTotalDenied()).isEqualTo(2);
        assertThat(stats.getDeniedByCode()).containsOnlyKeys(Constants.IP_BLOCKED).containsEntry(Constants.IP_BLOCKED, 2L);
    }

    @Test
    void trackedConnectionIsReleasedAfterTheRequest() throws Exception {
        mockMvc.perform(products("198.51.100.6")).andExpect(status().isOk());

        assertThat(store.getLong(KeyManager.slowConnections("198.51.100.6"))).isZero();
    }

    @Test
    void userIdHeaderIsTreatedAsUnauthenticated() throws Exception {
        mockMvc.perform(products("198.51.100.7").header("X-User-Id", "victim")).andExpect(status().isOk());
        mockMvc.perform(products("198.51.100.7").requestAttr("userId", "u-7")).andExpect(status().isOk());

        assertThat(admittedEvents).extracting(SecurityEvent::getUserId).containsExactly(null, "u-7");
    }

    @Test
    void sqlInjectionInAPostBodyIsBlockedByTheWaf() throws Exception {
        mockMvc.perform(post("/api/v1/orders").header("X-Forwarded-For", "198.51.100.8")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"a@example.com\",\"name\":\"x' OR 1=1 --\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value(Constants.WAF_BLOCKED))
                .andExpect(jsonPath("$.category").value("SQL_INJECTION"));
    }

    @Test
    void paddingDoesNotHideAPayloadAtTheEndOfTheBody() throws Exception {
        String form = "note=" + "a".repeat(70_000) + "&name=x%27+OR+1%3D1+--";

        mockMvc.perform(post("/api/v1/orders").header("X-Forwarded-For", "198.51.100.9")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .content(form))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value(Constants.WAF_BLOCKED));
    }

    @Test
    void bodyOverTheLimitIsRejectedBeforeAnyStage() throws Exception {
        pipelineProps.setMaxBodyBytes(2048);
        intrusionService.blockIP("192.0.2.54", "manual", 600L);

        mockMvc.perform(post("/api/v1/orders").header("X-Forwarded-For", "192.0.2.54")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("x".repeat(4096)))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.code").value(Constants.PAYLOAD_TOO_LARGE));

        assertThat(admittedEvents).isEmpty();
    }
}
