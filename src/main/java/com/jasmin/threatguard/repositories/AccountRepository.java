package com.jasmin.threatguard.repositories;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AccountRepository {

    void lockAccount(String userId, String reason, Instant at);

    boolean unlockAccount(String userId);

    /** Users with at least one session active since the given instant. */
    List<String> findActiveUserIds(Instant since);

    long countUsersWithoutTwoFactor();

    Optional<Instant> findLatestVulnerabilityScan();
}
