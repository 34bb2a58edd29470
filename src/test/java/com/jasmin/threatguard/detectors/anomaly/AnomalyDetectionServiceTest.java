package com.jasmin.threatguard.detectors.anomaly;

import com.jasmin.threatguard.models.AnomalyDetection;
import com.jasmin.threatguard.models.AnomalyResult;
import com.jasmin.threatguard.models.RiskLevel;
import com.jasmin.threatguard.models.SessionInfo;
import com.jasmin.threatguard.models.UserBehaviorProfile;
import com.jasmin.threatguard.repositories.AccountRepository;
import com.jasmin.threatguard.repositories.AnomalyRepository;
import com.jasmin.threatguard.repositories.BehaviorProfileRepository;
import com.jasmin.threatguard.repositories.LoginAttemptRepository;
import com.jasmin.threatguard.repositories.SessionRepository;
import com.jasmin.threatguard.services.AuditService;
import com.jasmin.threatguard.store.StateStore;
import com.jasmin.threatguard.support.InMemoryStateStore;
import com.jasmin.threatguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    private static final String USER = "user-42";
    private static final String KNOWN_IP = "10.0.0.1";
    private static final String UA = "Mozilla/5.0 (X11; Linux x86_64) Firefox/128.0";

    @Mock
    private BehaviorProfileRepository profileRepository;
    @Mock
    private AnomalyRepository anomalyRepository;
    @Mock
    private SessionRepository sessionRepository;
    @Mock
    private LoginAttemptRepository loginAttemptRepository;
    @Mock
    private AccountRepository accountRepository;
    @Mock
    private AuditService auditService;

    private AnomalyProperties props;
    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2025-03-01T10:00:00Z");
        props = new AnomalyProperties();
        service = new AnomalyDetectionService(new InMemoryStateStore(clock), profileRepository, anomalyRepository,
                sessionRepository, loginAttemptRepository, accountRepository, auditService, props, clock);
    }

    private void storedProfile(List<String> ips, List<String> agents, List<Integer> hours) {
        UserBehaviorProfile profile = UserBehaviorProfile.builder()
                .userId(USER)
                .commonIps(ips)
                .commonUserAgents(agents)
                .typicalLoginHours(hours)
                .build();
        when(profileRepository.findByUserId(USER)).thenReturn(Optional.of(profile));
    }

    // unknown IP (20) + failed logins (30) + multiple IPs (weight under test)
    private AnomalyResult scoreWithMultipleIpWeight(int multipleIpWeight) {
        props.getWeights().setMultipleIps(multipleIpWeight);
        storedProfile(List.of(KNOWN_IP), List.of(UA), List.of(10));
        when(loginAttemptRepository.countFailedByUserSince(eq(USER), any(Instant.class))).thenReturn(4L);
        when(sessionRepository.countDistinctIpsSince(eq(USER), any(Instant.class))).thenReturn(4L);
        return service.detectAnomalies(USER, "203.0.113.9", UA, "/api/v1/products");
    }

    @Test
    void userWithoutProfileGetsOneBuiltAndScoresZero() {
        when(profileRepository.findByUserId(USER)).thenReturn(Optional.empty());
        when(sessionRepository.findByUserSince(eq(USER), any(Instant.class))).thenReturn(List.of(
                SessionInfo.builder().ipAddress(KNOWN_IP).userAgent(UA).build(),
                SessionInfo.builder().ipAddress(KNOWN_IP).userAgent(UA).build(),
                SessionInfo.builder().ipAddress("10.0.0.2").userAgent(UA).build()));
        when(loginAttemptRepository.findSuccessfulLoginTimes(eq(USER), any(Instant.class))).thenReturn(List.of(
                Instant.parse("2025-02-27T09:15:00Z"), Instant.parse("2025-02-28T09:40:00Z"), Instant.parse("2025-02-28T18:00:00Z")));

        AnomalyResult result = service.detectAnomalies(USER, "203.0.113.9", UA, "/api/v1/products");

        assertThat(result.getScore()).isZero();
        assertThat(result.isShouldBlock()).isFalse();
        ArgumentCaptor<UserBehaviorProfile> captor = ArgumentCaptor.forClass(UserBehaviorProfile.class);
        verify(profileRepository).upsert(captor.capture());
        assertThat(captor.getValue().getCommonIps()).containsExactly(KNOWN_IP, "10.0.0.2");
        assertThat(captor.getValue().getCommonUserAgents()).containsExactly(UA);
        assertThat(captor.getValue().getTypicalLoginHours()).containsExactly(9, 18);
    }

    @Test
    void anonymousRequestIsNotScored() {
        assertThat(service.detectAnomalies(null, "203.0.113.9", UA, "/")).isEqualTo(AnomalyResult.none());
        verify(profileRepository, never()).findByUserId(anyString());
    }

    @Test
    void matchingBehaviorScoresZero() {
        storedProfile(List.of(KNOWN_IP), List.of(UA), List.of(10));

        AnomalyResult result = service.detectAnomalies(USER, KNOWN_IP, UA, "/api/v1/products");

        assertThat(result.getScore()).isZero();
        assertThat(result.getAnomalies()).isEmpty();
        verify(anomalyRepository, never()).save(any());
    }

    @Test
    void scoreBelowTheBlockThresholdIsRecordedWithoutLocking() {
        AnomalyResult result = scoreWithMultipleIpWeight(19);

        assertThat(result.getScore()).isEqualTo(69);
        assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.isShouldBlock()).isFalse();
        assertThat(result.getAnomalies()).containsExactly("unknown_ip", "failed_logins", "multiple_ips");
        verify(anomalyRepository).save(any(AnomalyDetection.class));
        verify(accountRepository, never()).lockAccount(anyString(), anyString(), any());
    }

    @Test
    void scoreAtTheBlockThresholdLocksTheAccount() {
        when(sessionRepository.deleteAllForUser(USER)).thenReturn(2);

        AnomalyResult result = scoreWithMultipleIpWeight(20);

        assertThat(result.getScore()).isEqualTo(70);
        assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(result.isShouldBlock()).isTrue();
        verify(accountRepository).lockAccount(eq(USER), eq("anomaly_score_70"), any(Instant.class));
        verify(sessionRepository).deleteAllForUser(USER);
        verify(auditService).record(eq("account_locked_anomaly"), eq(USER), eq("203.0.113.9"), any());
    }

    @Test
    void unfamiliarUserAgentAndUnusualHourAreScored() {
        storedProfile(List.of(KNOWN_IP), List.of(UA), List.of(2, 3));

        AnomalyResult result = service.detectAnomalies(USER, KNOWN_IP, "python-requests/2.31", "/api/v1/products");

        assertThat(result.getAnomalies()).containsExactly("unfamiliar_user_agent", "unusual_hour");
        assertThat(result.getScore()).isEqualTo(25);
    }

    @Test
    void emptyBaselineListsAreNotSignals() {
        storedProfile(List.of(), List.of(), List.of());

        assertThat(service.detectAnomalies(USER, "203.0.113.9", "anything", "/api/v1/products").getScore()).isZero();
    }

    @Test
    void repeatedSensitiveAccessIsScoredAfterTheThreshold() {
        storedProfile(List.of(), List.of(), List.of());

        for (int i = 0; i < 5; i++) {
            assertThat(service.detectAnomalies(USER, KNOWN_IP, UA, "/admin/users").getAnomalies()).isEmpty();
        }
        AnomalyResult sixth = service.detectAnomalies(USER, KNOWN_IP, UA, "/admin/users");

        assertThat(sixth.getAnomalies()).containsExactly("sensitive_endpoint_access");
        assertThat(sixth.getScore()).isEqualTo(15);
    }

    @Test
    void unlockRecordsAnAuditEntryOnlyWhenSomethingWasUnlocked() {
        when(accountRepository.unlockAccount(USER)).thenReturn(true, false);

        assertThat(service.unlockAccount(USER, "ops")).isTrue();
        assertThat(service.unlockAccount(USER, "ops")).isFalse();
        verify(auditService).record(eq("account_unlocked"), eq(USER), isNull(), any());
    }

    @Test
    void profileRefreshContinuesPastAFailingUser() {
        when(accountRepository.findActiveUserIds(any(Instant.class))).thenReturn(List.of("a", "b"));
        when(sessionRepository.findByUserSince(eq("a"), any(Instant.class))).thenThrow(new IllegalStateException("boom"));
        when(sessionRepository.findByUserSince(eq("b"), any(Instant.class))).thenReturn(List.of());

        assertThat(service.updateAllProfiles()).isEqualTo(1);
    }

    @Test
    void profileAverageReadsTheWholeWindowInOneCall() {
        MutableClock clock = MutableClock.at("2025-03-01T10:30:00Z");
        StateStore store = mock(StateStore.class);
        when(store.sum(anyList())).thenReturn(336L);
        AnomalyDetectionService withStore = new AnomalyDetectionService(store, profileRepository, anomalyRepository,
                sessionRepository, loginAttemptRepository, accountRepository, auditService, props, clock);

        UserBehaviorProfile profile = withStore.buildProfile(USER);

        assertThat(profile.getAvgRequestsPerHour()).isEqualTo(2.0);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        verify(store).sum(keys.capture());
        assertThat(keys.getValue()).hasSize(168).doesNotHaveDuplicates();
        verify(store, never()).getLong(anyString());
    }
}
