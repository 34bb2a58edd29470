package com.jasmin.threatguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Generic grouped count row used by the statistics queries. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class CountByKey {
    private String key;
    private long count;
    private long uniqueIps;
}
