package com.jasmin.threatguard.repositories;

import com.jasmin.threatguard.models.AnomalyDetection;
import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.RiskLevel;

import java.time.Instant;
import java.util.List;

public interface AnomalyRepository {

    void save(AnomalyDetection detection);

    long countSince(Instant since);

    long countByRiskSince(RiskLevel risk, Instant since);

    /** Detections grouped by risk level; {@code uniqueIps} carries the distinct user count. */
    List<CountByKey> countByRiskSince(Instant since);

    int deleteOlderThan(Instant cutoff);
}
