package com.jasmin.threatguard.repositories;

import java.time.Instant;

public interface AuditLogRepository {

    void save(String action, String userId, String ip, String detailsJson, Instant timestamp);
}
