package com.jasmin.threatguard.repositories.jdbc;

import com.jasmin.threatguard.repositories.LoginAttemptRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.jasmin.threatguard.repositories.jdbc.JdbcSupport.*;

@Repository
@RequiredArgsConstructor
public class JdbcLoginAttemptRepository implements LoginAttemptRepository {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<Instant> findSuccessfulLoginTimes(String userId, Instant since) {
        return jdbcTemplate.query(
                "SELECT attempted_at FROM login_attempts WHERE user_id = ? AND success = TRUE AND attempted_at > ?",
                (rs, i) -> instant(rs, "attempted_at"), userId, ts(since));
    }

    @Override
    public long countFailedByUserSince(String userId, Instant since) {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM login_attempts WHERE user_id = ? AND success = FALSE AND attempted_at > ?",
                Long.class, userId, ts(since)));
    }

    @Override
    public long countFailedByIpSince(String ip, Instant since) {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM login_attempts WHERE ip_address = ? AND success = FALSE AND attempted_at > ?",
                Long.class, ip, ts(since)));
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM login_attempts WHERE attempted_at < ?", ts(cutoff));
    }
}
