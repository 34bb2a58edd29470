package com.jasmin.threatguard.services.monitoring;

import com.jasmin.threatguard.detectors.anomaly.AnomalyDetectionService;
import com.jasmin.threatguard.detectors.ddos.DdosProtectionService;
import com.jasmin.threatguard.detectors.waf.WafService;
import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.repositories.AccountRepository;
import com.jasmin.threatguard.repositories.AlertRepository;
import com.jasmin.threatguard.repositories.IncidentRepository;
import com.jasmin.threatguard.repositories.SessionRepository;
import com.jasmin.threatguard.services.intrusion.IntrusionPreventionService;
import com.jasmin.threatguard.services.intrusion.IntrusionStats;
import com.jasmin.threatguard.services.secrets.RotationStatus;
import com.jasmin.threatguard.services.secrets.SecretsManagementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class DashboardService {

    private static final int DAY_HOURS = 24;

    private final IntrusionPreventionService intrusionService;
    private final DdosProtectionService ddosService;
    private final AnomalyDetectionService anomalyService;
    private final WafService wafService;
    private final SecretsManagementService secretsService;
    private final AlertRepository alertRepository;
    private final IncidentRepository incidentRepository;
    private final SessionRepository sessionRepository;
    private final AccountRepository accountRepository;
    private final MonitoringProperties props;
    private final InstantSource clock;

    public SecurityDashboard getDashboard() {
        Instant now = clock.instant();
        Instant dayAgo = now.minus(Duration.ofHours(DAY_HOURS));

        long blockedIps = intrusionService.countActiveBlocks();
        IntrusionStats intrusions = intrusionService.getIntrusionStats(DAY_HOURS);
        List<CountByKey> ddosAttackers = ddosService.getTopAttackers(Integer.MAX_VALUE);

        SecurityDashboard.Overview overview = new SecurityDashboard.Overview(
                ddosService.getMetrics().getThreatLevel(),
                incidentRepository.countOpen(),
                blockedIps,
                alertRepository.countActive(),
                alertRepository.countBySeveritySince(dayAgo));

        SecurityDashboard.Metrics metrics = new SecurityDashboard.Metrics(
                intrusions.getTotal(),
                ddosAttackers.stream().mapToLong(CountByKey::getCount).sum(),
                anomalyService.getAnomalyStats(DAY_HOURS).getTotal(),
                wafService.getStats(DAY_HOURS).getTotalViolations());

        SecurityDashboard.ThreatSources sources = new SecurityDashboard.ThreatSources(
                wafService.getTopBlockedIps(DAY_HOURS, props.getTopSources()),
                ddosAttackers.stream().limit(props.getTopSources()).collect(Collectors.toList()));

        return SecurityDashboard.builder()
                .overview(overview)
                .recentIncidents(incidentRepository.findRecent(props.getRecentIncidents()))
                .topThreats(intrusions.getByType())
                .topThreatSources(sources)
                .metrics(metrics)
                .recommendations(recommendations(now, blockedIps))
                .generatedAt(now)
                .build();
    }

    List<String> recommendations(Instant now, long blockedIps) {
        List<String> out = new ArrayList<>();

        Instant lastScan = accountRepository.findLatestVulnerabilityScan().orElse(null);
        if (lastScan == null || lastScan.isBefore(now.minus(Duration.ofDays(props.getVulnerabilityScanMaxAgeDays())))) {
            out.add("Run vulnerability scan (last scan > " + props.getVulnerabilityScanMaxAgeDays() + " days ago)");
        }
        long withoutTwoFactor = accountRepository.countUsersWithoutTwoFactor();
        if (withoutTwoFactor > 0) {
            out.add("Enable 2FA for " + withoutTwoFactor + " users");
        }
        long staleSessions = sessionRepository.countInactiveSince(now.minus(Duration.ofDays(props.getInactiveSessionDays())));
        if (staleSessions > 0) {
            out.add("Clean up " + staleSessions + " stale sessions");
        }
        if (blockedIps > props.getBlockedIpRecommendationThreshold()) {
            out.add("Review " + blockedIps + " blocked IPs");
        }
        for (RotationStatus status : secretsService.getRotationStatus()) {
            if (status.isRotationNeeded()) {
                out.add("Rotate " + status.getSecretType().value() + " (overdue)");
            }
        }
        return out;
    }

    public SecurityStats getSecurityStats(int days) {
        int hours = days * DAY_HOURS;
        Instant since = clock.instant().minus(Duration.ofDays(days));
        return new SecurityStats(days,
                intrusionService.getIntrusionStats(hours),
                anomalyService.getAnomalyStats(hours),
                incidentRepository.countBySeveritySince(since),
                alertRepository.countBySeveritySince(since));
    }

    /** Report over the trailing {@code days} days. */
    public SecurityReport generateReport(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        Instant now = clock.instant();
        SecurityStats stats = getSecurityStats(days);
        SecurityReport.Summary summary = new SecurityReport.Summary(
                sum(stats.getIncidentsBySeverity()),
                sum(stats.getAlertsBySeverity()),
                stats.getIntrusions().getTotal(),
                stats.getAnomalies().getTotal());

        log.info("Security report generated: days={}", days);
        return SecurityReport.builder()
                .generatedAt(now)
                .periodStart(now.minus(Duration.ofDays(days)))
                .periodEnd(now)
                .dashboard(getDashboard())
                .stats(stats)
                .waf(wafService.getStats(days * DAY_HOURS))
                .secretRotation(secretsService.getRotationStatus())
                .summary(summary)
                .build();
    }

    private static long sum(List<CountByKey> rows) {
        return rows == null ? 0 : rows.stream().mapToLong(CountByKey::getCount).sum();
    }
}
