package com.jasmin.threatguard.repositories.jdbc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.jasmin.threatguard.models.UserBehaviorProfile;
import com.jasmin.threatguard.repositories.BehaviorProfileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

import static com.jasmin.threatguard.repositories.jdbc.JdbcSupport.*;

@Repository
@RequiredArgsConstructor
public class JdbcBehaviorProfileRepository implements BehaviorProfileRepository {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void upsert(UserBehaviorProfile p) {
        String sql = """
            INSERT INTO user_behavior_profiles (
                user_id, avg_requests_per_hour, common_ips, common_user_agents, typical_login_hours, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (user_id)
            DO UPDATE SET
                avg_requests_per_hour = EXCLUDED.avg_requests_per_hour,
                common_ips = EXCLUDED.common_ips,
                common_user_agents = EXCLUDED.common_user_agents,
                typical_login_hours = EXCLUDED.typical_login_hours,
                updated_at = EXCLUDED.updated_at
            """;
        jdbcTemplate.update(sql, p.getUserId(), p.getAvgRequestsPerHour(), json(p.getCommonIps()),
                json(p.getCommonUserAgents()), json(p.getTypicalLoginHours()), ts(p.getUpdatedAt()));
    }

    @Override
    public Optional<UserBehaviorProfile> findByUserId(String userId) {
        return jdbcTemplate.query("SELECT * FROM user_behavior_profiles WHERE user_id = ?",
                (rs, i) -> UserBehaviorProfile.builder()
                        .userId(rs.getString("user_id"))
                        .avgRequestsPerHour(rs.getDouble("avg_requests_per_hour"))
                        .commonIps(list(rs.getString("common_ips"), new TypeReference<List<String>>() {}))
                        .commonUserAgents(list(rs.getString("common_user_agents"), new TypeReference<List<String>>() {}))
                        .typicalLoginHours(list(rs.getString("typical_login_hours"), new TypeReference<List<Integer>>() {}))
                        .updatedAt(instant(rs, "updated_at"))
                        .build(),
                userId).stream().findFirst();
    }
}
