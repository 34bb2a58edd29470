package com.jasmin.threatguard.detectors.anomaly;

import com.jasmin.threatguard.models.CountByKey;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class AnomalyStats {
    private int hours;
    private long total;
    private long critical;

    // key = risk level, uniqueIps = distinct users
    private List<CountByKey> byRisk;
}
