package com.jasmin.threatguard.repositories;

import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.models.IncidentStatus;
import com.jasmin.threatguard.models.SecurityIncident;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface IncidentRepository {

    long insert(SecurityIncident incident);

    Optional<SecurityIncident> findById(long id);

    void updateStatus(long id, IncidentStatus status, String resolutionNotes, Instant resolvedAt);

    List<SecurityIncident> findRecent(int limit);

    long countOpen();

    List<CountByKey> countBySeveritySince(Instant since);
}
