package com.jasmin.threatguard.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Terminal decision of a pipeline stage. Serialized as the JSON body of the denial response.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DetectionVerdict {
    @JsonIgnore
    private int status;

    private String error;
    private String code;

    // seconds
    private Long retryAfter;

    private String challenge;
    private String ruleId;
    private String category;
    private Boolean reauthRequired;

    public static DetectionVerdict deny(int status, String code, String error) {
        return DetectionVerdict.builder().status(status).code(code).error(error).build();
    }

    public static DetectionVerdict deny(int status, String code, String error, Long retryAfter) {
        return DetectionVerdict.builder().status(status).code(code).error(error).retryAfter(retryAfter).build();
    }
}
