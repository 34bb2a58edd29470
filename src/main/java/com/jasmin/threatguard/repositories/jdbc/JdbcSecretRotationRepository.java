package com.jasmin.threatguard.repositories.jdbc;

import com.jasmin.threatguard.models.SecretRotationRecord;
import com.jasmin.threatguard.repositories.SecretRotationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

import static com.jasmin.threatguard.repositories.jdbc.JdbcSupport.*;

@Repository
@RequiredArgsConstructor
public class JdbcSecretRotationRepository implements SecretRotationRepository {

    private static final RowMapper<SecretRotationRecord> MAPPER = (rs, i) -> SecretRotationRecord.builder()
            .secretType(rs.getString("secret_type"))
            .rotatedAt(instant(rs, "rotated_at"))
            .rotatedBy(rs.getString("rotated_by"))
            .oldSecretHash(rs.getString("old_secret_hash"))
            .newSecretHash(rs.getString("new_secret_hash"))
            .reason(rs.getString("reason"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void save(SecretRotationRecord r) {
        String sql = """
            INSERT INTO secret_rotations (secret_type, rotated_at, rotated_by, old_secret_hash, new_secret_hash, reason)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql, r.getSecretType(), ts(r.getRotatedAt()), r.getRotatedBy(), r.getOldSecretHash(),
                r.getNewSecretHash(), r.getReason());
    }

    @Override
    public Optional<SecretRotationRecord> findLatest(String secretType) {
        return jdbcTemplate.query(
                "SELECT * FROM secret_rotations WHERE secret_type = ? ORDER BY rotated_at DESC LIMIT 1",
                MAPPER, secretType).stream().findFirst();
    }

    @Override
    public List<SecretRotationRecord> findHistory(String secretType, int limit) {
        if (secretType == null) {
            return jdbcTemplate.query("SELECT * FROM secret_rotations ORDER BY rotated_at DESC LIMIT ?", MAPPER, limit);
        }
        return jdbcTemplate.query(
                "SELECT * FROM secret_rotations WHERE secret_type = ? ORDER BY rotated_at DESC LIMIT ?",
                MAPPER, secretType, limit);
    }
}
