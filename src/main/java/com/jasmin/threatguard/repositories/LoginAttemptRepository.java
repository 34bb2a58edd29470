package com.jasmin.threatguard.repositories;

import java.time.Instant;
import java.util.List;

public interface LoginAttemptRepository {

    List<Instant> findSuccessfulLoginTimes(String userId, Instant since);

    long countFailedByUserSince(String userId, Instant since);

    long countFailedByIpSince(String ip, Instant since);

    int deleteOlderThan(Instant cutoff);
}
