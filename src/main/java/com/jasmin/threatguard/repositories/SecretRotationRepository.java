package com.jasmin.threatguard.repositories;

import com.jasmin.threatguard.models.SecretRotationRecord;

import java.util.List;
import java.util.Optional;

public interface SecretRotationRepository {

    void save(SecretRotationRecord record);

    Optional<SecretRotationRecord> findLatest(String secretType);

    /** Newest first; a {@code null} type returns every secret type. */
    List<SecretRotationRecord> findHistory(String secretType, int limit);
}
