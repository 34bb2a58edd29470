package com.jasmin.threatguard.services.intrusion;

import com.jasmin.threatguard.models.CountByKey;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class IntrusionStats {
    private int hours;
    private long total;
    private long critical;
    private List<CountByKey> byType;
    private List<CountByKey> bySeverity;
}
