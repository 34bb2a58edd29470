package com.jasmin.threatguard.controllers;

import com.jasmin.threatguard.detectors.anomaly.AnomalyDetectionService;
import com.jasmin.threatguard.detectors.ddos.DdosProtectionService;
import com.jasmin.threatguard.detectors.waf.WafService;
import com.jasmin.threatguard.services.intrusion.IntrusionPreventionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OperatorAccessInterceptorTest {

    @Mock
    private IntrusionPreventionService intrusionService;
    @Mock
    private WafService wafService;
    @Mock
    private DdosProtectionService ddosService;
    @Mock
    private AnomalyDetectionService anomalyService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ThreatControlController(intrusionService, wafService, ddosService, anomalyService))
                .setControllerAdvice(new ApiExceptionHandler())
                .addInterceptors(new OperatorAccessInterceptor(new OperatorProperties()))
                .build();
    }

    @Test
    void anonymousCallerIsRejectedWith401() throws Exception {
        mockMvc.perform(delete("/api/v1/security/ip-blocks/203.0.113.9"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));

        verifyNoInteractions(intrusionService);
    }

    @Test
    void identityHeadersAreNotTrusted() throws Exception {
        mockMvc.perform(delete("/api/v1/security/ip-blocks/203.0.113.9")
                        .header("X-User-Id", "ops")
                        .header("X-User-Role", "admin"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(intrusionService);
    }

    @Test
    void authenticatedNonAdminIsRejectedWith403() throws Exception {
        mockMvc.perform(post("/api/v1/security/accounts/user-1/unlock")
                        .requestAttr("userId", "user-2")
                        .requestAttr("userRole", "user"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));

        verifyNoInteractions(anomalyService);
    }

    @Test
    void adminIsAdmittedAndRecordedAsTheActor() throws Exception {
        when(anomalyService.unlockAccount("user-1", "admin-7")).thenReturn(true);

        mockMvc.perform(post("/api/v1/security/accounts/user-1/unlock")
                        .requestAttr("userId", "admin-7")
                        .requestAttr("userRole", "ADMIN"))
                .andExpect(status().isOk());

        verify(anomalyService).unlockAccount("user-1", "admin-7");
    }
}
