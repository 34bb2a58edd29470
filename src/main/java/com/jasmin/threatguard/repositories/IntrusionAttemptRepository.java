package com.jasmin.threatguard.repositories;

import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.IntrusionAttempt;
import com.jasmin.threatguard.models.Severity;

import java.time.Instant;
import java.util.List;

public interface IntrusionAttemptRepository {

    void save(IntrusionAttempt attempt);

    List<Instant> findTimestampsByIpSince(String ip, Instant since);

    List<CountByKey> countByTypeSince(Instant since);

    List<CountByKey> countBySeveritySince(Instant since);

    long countSince(Instant since);

    long countBySeveritySince(Severity severity, Instant since);

    int deleteOlderThan(Instant cutoff);
}
