package com.jasmin.threatguard.repositories.jdbc;

import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.Violation;
import com.jasmin.threatguard.repositories.ViolationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.jasmin.threatguard.repositories.jdbc.JdbcSupport.*;

@Repository
@RequiredArgsConstructor
public class JdbcViolationRepository implements ViolationRepository {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void save(Violation v) {
        String sql = """
            INSERT INTO waf_blocks (
                ip_address, rule_id, rule_name, category, severity, action, description,
                method, path, headers, body, user_agent, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql, v.getIp(), v.getRuleId(), v.getRuleName(), v.getCategory(),
                v.getSeverity().value(), v.getAction(), v.getDescription(), v.getMethod(), v.getPath(),
                v.getHeadersSnapshot(), v.getBodySnapshot(), v.getUserAgent(), ts(v.getTimestamp()));
    }

    @Override
    public long countSince(Instant since) {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM waf_blocks WHERE created_at > ?", Long.class, ts(since)));
    }

    @Override
    public List<Instant> findBlockingTimestampsByIpSince(String ip, Instant since) {
        return jdbcTemplate.query(
                "SELECT created_at FROM waf_blocks WHERE ip_address = ? AND action = 'block' AND created_at > ?",
                (rs, i) -> instant(rs, "created_at"), ip, ts(since));
    }

    @Override
    public List<CountByKey> topRulesSince(Instant since, int limit) {
        String sql = """
            SELECT rule_id AS k, COUNT(*) AS cnt, COUNT(DISTINCT ip_address) AS uniq
            FROM waf_blocks
            WHERE created_at > ?
            GROUP BY rule_id
            ORDER BY cnt DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, COUNT_BY_KEY, ts(since), limit);
    }

    @Override
    public List<CountByKey> topIpsSince(Instant since, int limit) {
        String sql = """
            SELECT ip_address AS k, COUNT(*) AS cnt, COUNT(DISTINCT rule_id) AS uniq
            FROM waf_blocks
            WHERE created_at > ?
            GROUP BY ip_address
            ORDER BY cnt DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, COUNT_BY_KEY, ts(since), limit);
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM waf_blocks WHERE created_at < ?", ts(cutoff));
    }
}
