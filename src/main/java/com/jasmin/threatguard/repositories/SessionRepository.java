package com.jasmin.threatguard.repositories;

import com.jasmin.threatguard.models.SessionInfo;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Identity-layer sessions. The pipeline reads them and terminates them; it never creates them.
 */
public interface SessionRepository {

    List<SessionInfo> findByUserSince(String userId, Instant since);

    /** Most recent session of the user other than {@code currentSessionId} (which may be null). */
    Optional<SessionInfo> findLatestExcluding(String userId, String currentSessionId);

    long countDistinctIpsSince(String userId, Instant since);

    int deleteAllForUser(String userId);

    long countInactiveSince(Instant lastActivityBefore);

    int deleteInactiveBefore(Instant lastActivityBefore);
}
