package com.jasmin.threatguard.detectors.anomaly;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class TakeoverAssessment {
    private int score;
    private List<String> factors;
    private boolean suspicious;

    public static TakeoverAssessment clean() {
        return new TakeoverAssessment(0, List.of(), false);
    }
}
