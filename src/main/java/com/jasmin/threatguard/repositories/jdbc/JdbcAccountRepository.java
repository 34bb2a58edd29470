package com.jasmin.threatguard.repositories.jdbc;

import com.jasmin.threatguard.repositories.AccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.jasmin.threatguard.repositories.jdbc.JdbcSupport.*;

@Repository
@RequiredArgsConstructor
public class JdbcAccountRepository implements AccountRepository {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void lockAccount(String userId, String reason, Instant at) {
        jdbcTemplate.update("UPDATE users SET account_locked = TRUE, lock_reason = ?, locked_at = ? WHERE id = ?",
                reason, ts(at), userId);
    }

    @Override
    public boolean unlockAccount(String userId) {
        return jdbcTemplate.update(
                "UPDATE users SET account_locked = FALSE, lock_reason = NULL, locked_at = NULL WHERE id = ?",
                userId) > 0;
    }

    @Override
    public List<String> findActiveUserIds(Instant since) {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT user_id FROM user_sessions WHERE last_activity > ?", String.class, ts(since));
    }

    @Override
    public long countUsersWithoutTwoFactor() {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM users WHERE two_factor_enabled = FALSE", Long.class));
    }

    @Override
    public Optional<Instant> findLatestVulnerabilityScan() {
        return jdbcTemplate.query("SELECT MAX(scanned_at) AS scanned_at FROM vulnerability_scans",
                (rs, i) -> instant(rs, "scanned_at")).stream().filter(Objects::nonNull).findFirst();
    }
}
