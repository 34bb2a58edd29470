package com.jasmin.threatguard.repositories;

import com.jasmin.threatguard.models.IpBlockRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One row per IP. {@link #upsert} replaces any existing record for the same IP.
 */
public interface IpBlockRepository {

    void upsert(IpBlockRecord record);

    Optional<IpBlockRecord> findByIp(String ip);

    boolean delete(String ip);

    long countActive(Instant now);

    List<IpBlockRecord> findActive(Instant now, int limit);

    int deleteExpired(Instant now);
}
