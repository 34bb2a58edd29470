package com.jasmin.threatguard.repositories.jdbc;

import com.jasmin.threatguard.models.IpBlockRecord;
import com.jasmin.threatguard.repositories.IpBlockRepository;
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
public class JdbcIpBlockRepository implements IpBlockRepository {

    private static final RowMapper<IpBlockRecord> MAPPER = (rs, i) -> IpBlockRecord.builder()
            .ip(rs.getString("ip_address"))
            .reason(rs.getString("reason"))
            .blockedUntil(instant(rs, "blocked_until"))
            .permanent(rs.getBoolean("permanent"))
            .createdAt(instant(rs, "created_at"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void upsert(IpBlockRecord r) {
        String sql = """
            INSERT INTO ip_blacklist (ip_address, reason, blocked_until, permanent, created_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (ip_address)
            DO UPDATE SET
                reason = EXCLUDED.reason,
                blocked_until = EXCLUDED.blocked_until,
                permanent = EXCLUDED.permanent,
                created_at = EXCLUDED.created_at
            """;
        jdbcTemplate.update(sql, r.getIp(), r.getReason(), ts(r.getBlockedUntil()), r.isPermanent(),
                ts(r.getCreatedAt()));
    }

    @Override
    public Optional<IpBlockRecord> findByIp(String ip) {
        return jdbcTemplate.query("SELECT * FROM ip_blacklist WHERE ip_address = ?", MAPPER, ip)
                .stream().findFirst();
    }

    @Override
    public boolean delete(String ip) {
        return jdbcTemplate.update("DELETE FROM ip_blacklist WHERE ip_address = ?", ip) > 0;
    }

    @Override
    public long countActive(Instant now) {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM ip_blacklist WHERE permanent = TRUE OR blocked_until > ?",
                Long.class, ts(now)));
    }

    @Override
    public List<IpBlockRecord> findActive(Instant now, int limit) {
        String sql = """
            SELECT * FROM ip_blacklist
            WHERE permanent = TRUE OR blocked_until > ?
            ORDER BY created_at DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, MAPPER, ts(now), limit);
    }

    @Override
    public int deleteExpired(Instant now) {
        return jdbcTemplate.update(
                "DELETE FROM ip_blacklist WHERE permanent = FALSE AND blocked_until <= ?", ts(now));
    }
}
