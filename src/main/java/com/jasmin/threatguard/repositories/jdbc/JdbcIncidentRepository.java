package com.jasmin.threatguard.repositories.jdbc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.IncidentStatus;
import com.jasmin.threatguard.models.SecurityIncident;
import com.jasmin.threatguard.models.Severity;
import com.jasmin.threatguard.repositories.IncidentRepository;
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
public class JdbcIncidentRepository implements IncidentRepository {

    private static final RowMapper<SecurityIncident> MAPPER = (rs, i) -> SecurityIncident.builder()
            .id(rs.getLong("id"))
            .type(rs.getString("incident_type"))
            .severity(Severity.fromValue(rs.getString("severity")))
            .title(rs.getString("title"))
            .description(rs.getString("description"))
            .affectedUsers(list(rs.getString("affected_users"), new TypeReference<List<String>>() {}))
            .affectedIps(list(rs.getString("affected_ips"), new TypeReference<List<String>>() {}))
            .status(IncidentStatus.fromValue(rs.getString("status")))
            .createdAt(instant(rs, "created_at"))
            .resolvedAt(instant(rs, "resolved_at"))
            .resolutionNotes(rs.getString("resolution_notes"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public long insert(SecurityIncident inc) {
        String sql = """
            INSERT INTO security_incidents (
                incident_type, severity, title, description, affected_users, affected_ips, status, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """;
        Long id = jdbcTemplate.queryForObject(sql, Long.class, inc.getType(), inc.getSeverity().value(),
                inc.getTitle(), inc.getDescription(), json(inc.getAffectedUsers()), json(inc.getAffectedIps()),
                inc.getStatus().value(), ts(inc.getCreatedAt()));
        return count(id);
    }

    @Override
    public Optional<SecurityIncident> findById(long id) {
        return jdbcTemplate.query("SELECT * FROM security_incidents WHERE id = ?", MAPPER, id).stream().findFirst();
    }

    @Override
    public void updateStatus(long id, IncidentStatus status, String resolutionNotes, Instant resolvedAt) {
        String sql = """
            UPDATE security_incidents
            SET status = ?,
                resolution_notes = COALESCE(?, resolution_notes),
                resolved_at = COALESCE(?, resolved_at)
            WHERE id = ?
            """;
        jdbcTemplate.update(sql, status.value(), resolutionNotes, ts(resolvedAt), id);
    }

    @Override
    public List<SecurityIncident> findRecent(int limit) {
        return jdbcTemplate.query("SELECT * FROM security_incidents ORDER BY created_at DESC LIMIT ?", MAPPER, limit);
    }

    @Override
    public long countOpen() {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM security_incidents WHERE status IN ('open', 'investigating')", Long.class));
    }

    @Override
    public List<CountByKey> countBySeveritySince(Instant since) {
        String sql = """
            SELECT severity AS k, COUNT(*) AS cnt, COUNT(DISTINCT incident_type) AS uniq
            FROM security_incidents
            WHERE created_at > ?
            GROUP BY severity
            """;
        return jdbcTemplate.query(sql, COUNT_BY_KEY, ts(since));
    }
}
