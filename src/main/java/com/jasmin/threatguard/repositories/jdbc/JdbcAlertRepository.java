package com.jasmin.threatguard.repositories.jdbc;

import com.jasmin.threatguard.models.AlertStatus;
import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.SecurityAlert;
import com.jasmin.threatguard.models.Severity;
import com.jasmin.threatguard.repositories.AlertRepository;
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
public class JdbcAlertRepository implements AlertRepository {

    private static final RowMapper<SecurityAlert> MAPPER = (rs, i) -> SecurityAlert.builder()
            .id(rs.getLong("id"))
            .type(rs.getString("alert_type"))
            .severity(Severity.fromValue(rs.getString("severity")))
            .title(rs.getString("title"))
            .description(rs.getString("description"))
            .details(map(rs.getString("details")))
            .status(AlertStatus.fromValue(rs.getString("status")))
            .createdAt(instant(rs, "created_at"))
            .acknowledgedBy(rs.getString("acknowledged_by"))
            .acknowledgedAt(instant(rs, "acknowledged_at"))
            .resolvedAt(instant(rs, "resolved_at"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public long insert(SecurityAlert a) {
        String sql = """
            INSERT INTO security_alerts (alert_type, severity, title, description, details, status, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """;
        Long id = jdbcTemplate.queryForObject(sql, Long.class, a.getType(), a.getSeverity().value(),
                a.getTitle(), a.getDescription(), json(a.getDetails()), a.getStatus().value(),
                ts(a.getCreatedAt()));
        return count(id);
    }

    @Override
    public boolean existsByTypeSince(String type, Instant since) {
        Long n = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM security_alerts WHERE alert_type = ? AND created_at > ?",
                Long.class, type, ts(since));
        return count(n) > 0;
    }

    @Override
    public Optional<SecurityAlert> findById(long id) {
        return jdbcTemplate.query("SELECT * FROM security_alerts WHERE id = ?", MAPPER, id).stream().findFirst();
    }

    @Override
    public void updateStatus(long id, AlertStatus status, String actor, Instant at) {
        if (status == AlertStatus.ACKNOWLEDGED) {
            jdbcTemplate.update(
                    "UPDATE security_alerts SET status = ?, acknowledged_by = ?, acknowledged_at = ? WHERE id = ?",
                    status.value(), actor, ts(at), id);
        } else {
            jdbcTemplate.update("UPDATE security_alerts SET status = ?, resolved_at = ? WHERE id = ?",
                    status.value(), ts(at), id);
        }
    }

    @Override
    public List<SecurityAlert> findActive(int limit) {
        String sql = """
            SELECT * FROM security_alerts
            WHERE status IN ('new', 'acknowledged')
            ORDER BY created_at DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, MAPPER, limit);
    }

    @Override
    public long countActive() {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM security_alerts WHERE status IN ('new', 'acknowledged')", Long.class));
    }

    @Override
    public List<CountByKey> countBySeveritySince(Instant since) {
        String sql = """
            SELECT severity AS k, COUNT(*) AS cnt, COUNT(DISTINCT alert_type) AS uniq
            FROM security_alerts
            WHERE created_at > ?
            GROUP BY severity
            """;
        return jdbcTemplate.query(sql, COUNT_BY_KEY, ts(since));
    }
}
