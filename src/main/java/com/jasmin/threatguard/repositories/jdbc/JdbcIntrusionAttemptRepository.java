package com.jasmin.threatguard.repositories.jdbc;

import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.IntrusionAttempt;
import com.jasmin.threatguard.models.Severity;
import com.jasmin.threatguard.repositories.IntrusionAttemptRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.jasmin.threatguard.repositories.jdbc.JdbcSupport.*;

@Repository
@RequiredArgsConstructor
public class JdbcIntrusionAttemptRepository implements IntrusionAttemptRepository {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void save(IntrusionAttempt a) {
        String sql = """
            INSERT INTO intrusion_attempts (
                ip_address, user_id, attempt_type, severity, details, user_agent, path, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql, a.getIp(), a.getUserId(), a.getType(), a.getSeverity().value(),
                a.getDetails(), a.getUserAgent(), a.getPath(), ts(a.getTimestamp()));
    }

    @Override
    public List<Instant> findTimestampsByIpSince(String ip, Instant since) {
        return jdbcTemplate.query(
                "SELECT created_at FROM intrusion_attempts WHERE ip_address = ? AND created_at > ?",
                (rs, i) -> instant(rs, "created_at"), ip, ts(since));
    }

    @Override
    public List<CountByKey> countByTypeSince(Instant since) {
        String sql = """
            SELECT attempt_type AS k, COUNT(*) AS cnt, COUNT(DISTINCT ip_address) AS uniq
            FROM intrusion_attempts
            WHERE created_at > ?
            GROUP BY attempt_type
            ORDER BY cnt DESC
            """;
        return jdbcTemplate.query(sql, COUNT_BY_KEY, ts(since));
    }

    @Override
    public List<CountByKey> countBySeveritySince(Instant since) {
        String sql = """
            SELECT severity AS k, COUNT(*) AS cnt, COUNT(DISTINCT ip_address) AS uniq
            FROM intrusion_attempts
            WHERE created_at > ?
            GROUP BY severity
            """;
        return jdbcTemplate.query(sql, COUNT_BY_KEY, ts(since));
    }

    @Override
    public long countSince(Instant since) {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM intrusion_attempts WHERE created_at > ?", Long.class, ts(since)));
    }

    @Override
    public long countBySeveritySince(Severity severity, Instant since) {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM intrusion_attempts WHERE severity = ? AND created_at > ?",
                Long.class, severity.value(), ts(since)));
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM intrusion_attempts WHERE created_at < ?", ts(cutoff));
    }
}
