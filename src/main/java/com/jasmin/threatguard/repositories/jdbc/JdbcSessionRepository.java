package com.jasmin.threatguard.repositories.jdbc;

import com.jasmin.threatguard.models.SessionInfo;
import com.jasmin.threatguard.repositories.SessionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.jasmin.threatguard.repositories.jdbc.JdbcSupport.*;

@Repository
@RequiredArgsConstructor
public class JdbcSessionRepository implements SessionRepository {

    private static final RowMapper<SessionInfo> MAPPER = (rs, i) -> SessionInfo.builder()
            .sessionId(rs.getString("id"))
            .userId(rs.getString("user_id"))
            .ipAddress(rs.getString("ip_address"))
            .userAgent(rs.getString("user_agent"))
            .createdAt(instant(rs, "created_at"))
            .lastActivity(instant(rs, "last_activity"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<SessionInfo> findByUserSince(String userId, Instant since) {
        return jdbcTemplate.query(
                "SELECT * FROM user_sessions WHERE user_id = ? AND created_at > ? ORDER BY created_at DESC",
                MAPPER, userId, ts(since));
    }

    @Override
    public Optional<SessionInfo> findLatestExcluding(String userId, String currentSessionId) {
        String sql = """
            SELECT * FROM user_sessions
            WHERE user_id = ? AND (CAST(? AS VARCHAR) IS NULL OR id <> ?)
            ORDER BY created_at DESC
            LIMIT 1
            """;
        return jdbcTemplate.query(sql, MAPPER, userId, currentSessionId, currentSessionId).stream().findFirst();
    }

    @Override
    public long countDistinctIpsSince(String userId, Instant since) {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(DISTINCT ip_address) FROM user_sessions WHERE user_id = ? AND created_at > ?",
                Long.class, userId, ts(since)));
    }

    @Override
    public int deleteAllForUser(String userId) {
        return jdbcTemplate.update("DELETE FROM user_sessions WHERE user_id = ?", userId);
    }

    @Override
    public long countInactiveSince(Instant lastActivityBefore) {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM user_sessions WHERE last_activity < ?", Long.class, ts(lastActivityBefore)));
    }

    @Override
    public int deleteInactiveBefore(Instant lastActivityBefore) {
        return jdbcTemplate.update("DELETE FROM user_sessions WHERE last_activity < ?", ts(lastActivityBefore));
    }
}
