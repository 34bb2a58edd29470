package com.jasmin.threatguard.services;

import com.jasmin.threatguard.extractors.JsonUtils;
import com.jasmin.threatguard.repositories.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.InstantSource;
import java.util.Map;

/**
 * Append-only audit trail. Write failures are logged and never reach the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final InstantSource clock;

    public void record(String action, String userId, String ip, Map<String, Object> details) {
        try {
            auditLogRepository.save(action, userId, ip, JsonUtils.toJson(details), clock.instant());
        } catch (Exception e) {
            log.error("Failed to write audit entry: action={} userId={} ip={}", action, userId, ip, e);
        }
    }
}
