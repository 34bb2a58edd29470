package com.jasmin.threatguard.services.monitoring;

import com.jasmin.threatguard.detectors.anomaly.AnomalyStats;
import com.jasmin.threatguard.models.CountByKey;
import com.jasmin.threatguard.services.intrusion.IntrusionStats;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SecurityStats {
    private int days;
    private IntrusionStats intrusions;
    private AnomalyStats anomalies;
    private List<CountByKey> incidentsBySeverity;
    private List<CountByKey> alertsBySeverity;
}
