package com.jasmin.threatguard.repositories;

import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.Violation;

import java.time.Instant;
import java.util.List;

public interface ViolationRepository {

    void save(Violation violation);

    long countSince(Instant since);

    /** Timestamps of the IP's blocking violations; log-only matches are excluded. */
    List<Instant> findBlockingTimestampsByIpSince(String ip, Instant since);

    /** Rules ordered by hit count, with the number of distinct offending IPs. */
    List<CountByKey> topRulesSince(Instant since, int limit);

    List<CountByKey> topIpsSince(Instant since, int limit);

    int deleteOlderThan(Instant cutoff);
}
