package com.jasmin.threatguard.controllers;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.controllers.dto.BlockIpRequest;
import com.jasmin.threatguard.controllers.dto.GeoBlockRequest;
import com.jasmin.threatguard.detectors.anomaly.AnomalyDetectionService;
import com.jasmin.threatguard.detectors.anomaly.AnomalyStats;
import com.jasmin.threatguard.detectors.ddos.DdosMetrics;
import com.jasmin.threatguard.detectors.ddos.DdosProtectionService;
import com.jasmin.threatguard.detectors.waf.WafService;
import com.jasmin.threatguard.detectors.waf.WafStats;
import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.IpBlockRecord;
import com.jasmin.threatguard.models.ThreatScore;
import com.jasmin.threatguard.models.UserBehaviorProfile;
import com.jasmin.threatguard.services.intrusion.IntrusionPreventionService;
import com.jasmin.threatguard.services.intrusion.IntrusionStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Operator controls over blocks, geo blocks and locked accounts, plus the per-detector statistics.
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/security")
@Slf4j
public class ThreatControlController {
    private static final String MANUAL_BLOCK_REASON = "manual_block";

    private final IntrusionPreventionService intrusionService;
    private final WafService wafService;
    private final DdosProtectionService ddosService;
    private final AnomalyDetectionService anomalyService;

    @GetMapping("/ip-blocks")
    public List<IpBlockRecord> getActiveBlocks(@RequestParam(defaultValue = "100") int limit) {
        return intrusionService.listActiveBlocks(Params.checkLimit(limit));
    }

    @PostMapping("/ip-blocks")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> blockIp(@Valid @RequestBody BlockIpRequest request,
                                       @RequestAttribute(Constants.OPERATOR_ATTRIBUTE) String actor) {
        String reason = request.getReason() == null || request.getReason().isBlank()
                ? MANUAL_BLOCK_REASON : request.getReason();
        if (request.isPermanent()) {
            intrusionService.blockIPPermanently(request.getIp(), reason);
        } else {
            intrusionService.blockIP(request.getIp(), reason, request.getDurationSeconds());
        }
        log.info("Manual IP block: ip={} actor={} permanent={}", request.getIp(), actor, request.isPermanent());
        return Map.of("ip", request.getIp(), "blocked", true);
    }

    @DeleteMapping("/ip-blocks/{ip}")
    public ResponseEntity<Void> unblockIp(@PathVariable String ip) {
        intrusionService.unblockIP(ip);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/threat-score/{ip}")
    public ThreatScore getThreatScore(@PathVariable String ip) {
        return intrusionService.calculateThreatScore(ip);
    }

    @GetMapping("/intrusions/stats")
    public IntrusionStats getIntrusionStats(@RequestParam(defaultValue = "24") int hours) {
        return intrusionService.getIntrusionStats(Params.checkRange("hours", hours, 1, 24 * 90));
    }

    @GetMapping("/waf/stats")
    public WafStats getWafStats(@RequestParam(defaultValue = "24") int hours) {
        return wafService.getStats(Params.checkRange("hours", hours, 1, 24 * 90));
    }

    @GetMapping("/waf/top-ips")
    public List<CountByKey> getWafTopIps(@RequestParam(defaultValue = "24") int hours,
                                         @RequestParam(defaultValue = "10") int limit) {
        return wafService.getTopBlockedIps(Params.checkRange("hours", hours, 1, 24 * 90), Params.checkLimit(limit));
    }

    @GetMapping("/ddos/metrics")
    public DdosMetrics getDdosMetrics() {
        return ddosService.getMetrics();
    }

    @GetMapping("/ddos/attackers")
    public List<CountByKey> getTopAttackers(@RequestParam(defaultValue = "10") int limit) {
        return ddosService.getTopAttackers(Params.checkLimit(limit));
    }

    @PostMapping("/geo-blocks")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> blockCountry(@Valid @RequestBody GeoBlockRequest request) {
        ddosService.blockCountry(request.getCountry(), request.getDurationSeconds());
        return Map.of("country", request.getCountry().toUpperCase(Locale.ROOT), "blocked", true);
    }

    @DeleteMapping("/geo-blocks/{country}")
    public ResponseEntity<Void> unblockCountry(@PathVariable String country) {
        ddosService.unblockCountry(country);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/anomalies/stats")
    public AnomalyStats getAnomalyStats(@RequestParam(defaultValue = "24") int hours) {
        return anomalyService.getAnomalyStats(Params.checkRange("hours", hours, 1, 24 * 90));
    }

    @PostMapping("/anomalies/profiles/{userId}/rebuild")
    public UserBehaviorProfile rebuildProfile(@PathVariable String userId) {
        return anomalyService.buildProfile(userId);
    }

    @PostMapping("/accounts/{userId}/unlock")
    public Map<String, Object> unlockAccount(@PathVariable String userId,
                                             @RequestAttribute(Constants.OPERATOR_ATTRIBUTE) String actor) {
        if (!anomalyService.unlockAccount(userId, actor)) {
            throw new NoSuchElementException("No locked account for user: " + userId);
        }
        return Map.of("userId", userId, "unlocked", true);
    }
}
