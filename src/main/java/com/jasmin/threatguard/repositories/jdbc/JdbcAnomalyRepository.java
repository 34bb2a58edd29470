package com.jasmin.threatguard.repositories.jdbc;

import com.jasmin.threatguard.models.AnomalyDetection;
import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.RiskLevel;
import com.jasmin.threatguard.repositories.AnomalyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

import static com.jasmin.threatguard.repositories.jdbc.JdbcSupport.*;

@Repository
@RequiredArgsConstructor
public class JdbcAnomalyRepository implements AnomalyRepository {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void save(AnomalyDetection d) {
        String sql = """
            INSERT INTO anomaly_detections (
                user_id, ip_address, user_agent, endpoint, anomaly_score, anomaly_reasons, risk_level, detected_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql, d.getUserId(), d.getIp(), d.getUserAgent(), d.getEndpoint(), d.getScore(),
                json(d.getReasons()), riskValue(d.getRisk()), ts(d.getDetectedAt()));
    }

    @Override
    public long countSince(Instant since) {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM anomaly_detections WHERE detected_at > ?", Long.class, ts(since)));
    }

    @Override
    public long countByRiskSince(RiskLevel risk, Instant since) {
        return count(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM anomaly_detections WHERE risk_level = ? AND detected_at > ?",
                Long.class, riskValue(risk), ts(since)));
    }

    @Override
    public List<CountByKey> countByRiskSince(Instant since) {
        String sql = """
            SELECT risk_level AS k, COUNT(*) AS cnt, COUNT(DISTINCT user_id) AS uniq
            FROM anomaly_detections
            WHERE detected_at > ?
            GROUP BY risk_level
            """;
        return jdbcTemplate.query(sql, COUNT_BY_KEY, ts(since));
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM anomaly_detections WHERE detected_at < ?", ts(cutoff));
    }

    private static String riskValue(RiskLevel risk) {
        return risk.name().toLowerCase(Locale.ROOT);
    }
}
