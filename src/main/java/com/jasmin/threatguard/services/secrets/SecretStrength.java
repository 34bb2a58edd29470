package com.jasmin.threatguard.services.secrets;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SecretStrength {
    private int score;
    private boolean strong;
    private List<String> issues;
}
