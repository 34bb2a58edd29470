package com.jasmin.threatguard.repositories.jdbc;

import com.jasmin.threatguard.repositories.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static com.jasmin.threatguard.repositories.jdbc.JdbcSupport.ts;

@Repository
@RequiredArgsConstructor
public class JdbcAuditLogRepository implements AuditLogRepository {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void save(String action, String userId, String ip, String detailsJson, Instant timestamp) {
        jdbcTemplate.update(
                "INSERT INTO audit_log (action, user_id, ip_address, details, created_at) VALUES (?, ?, ?, ?, ?)",
                action, userId, ip, detailsJson, ts(timestamp));
    }
}
