package com.jasmin.threatguard.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ThreatScore {
    private String ip;

    // 0-100
    private int score;
    private ThreatBand band;
    private boolean blocked;

    // factor name -> contribution, before capping
    private Map<String, Double> factors;

    public static ThreatScore none(String ip) {
        return new ThreatScore(ip, 0, ThreatBand.NORMAL, false, Map.of());
    }
}
