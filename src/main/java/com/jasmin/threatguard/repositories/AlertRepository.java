package com.jasmin.threatguard.repositories;

import com.jasmin.threatguard.models.AlertStatus;
import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.SecurityAlert;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AlertRepository {

    long insert(SecurityAlert alert);

    boolean existsByTypeSince(String type, Instant since);

    Optional<SecurityAlert> findById(long id);

    void updateStatus(long id, AlertStatus status, String actor, Instant at);

    /** Alerts with status new or acknowledged, newest first. */
    List<SecurityAlert> findActive(int limit);

    long countActive();

    List<CountByKey> countBySeveritySince(Instant since);
}
