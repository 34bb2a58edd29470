package com.jasmin.threatguard.engine;

import com.jasmin.threatguard.detectors.Detector;
import com.jasmin.threatguard.models.DetectionVerdict;
import com.jasmin.threatguard.models.SecurityEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AdmissionPipelineTest {

    private final List<String> calls = new ArrayList<>();
    private final SecurityEvent event = SecurityEvent.builder().ip("192.0.2.1").path("/api/v1/orders").build();

    private Detector passing(String name) {
        return e -> {
            calls.add(name);
            return Optional.empty();
        };
    }

    private Detector denying(String name, String code) {
        return e -> {
            calls.add(name);
            return Optional.of(DetectionVerdict.deny(403, code, "denied"));
        };
    }

    private Detector throwing(String name) {
        return e -> {
            calls.add(name);
            throw new IllegalStateException("store unavailable");
        };
    }

    @Test
    void allStagesPassInOrder() {
        AdmissionPipeline pipeline = new AdmissionPipeline(List.of(passing("a"), passing("b"), passing("c")));

        assertThat(pipeline.evaluate(event)).isEmpty();
        assertThat(calls).containsExactly("a", "b", "c");
    }

    @Test
    void firstVerdictShortCircuits() {
        AdmissionPipeline pipeline = new AdmissionPipeline(List.of(
                passing("a"), denying("b", "IP_BLOCKED"), denying("c", "BOT_DETECTED")));

        Optional<DetectionVerdict> verdict = pipeline.evaluate(event);

        assertThat(verdict).map(DetectionVerdict::getCode).contains("IP_BLOCKED");
        assertThat(calls).containsExactly("a", "b");
    }

    @Test
    void failingStageIsSkipped() {
        AdmissionPipeline pipeline = new AdmissionPipeline(List.of(
                throwing("a"), denying("b", "WAF_BLOCKED")));

        assertThat(pipeline.evaluate(event)).map(DetectionVerdict::getCode).contains("WAF_BLOCKED");
        assertThat(calls).containsExactly("a", "b");
    }

    @Test
    void onlyFailingStagesAdmit() {
        AdmissionPipeline pipeline = new AdmissionPipeline(List.of(throwing("a"), throwing("b")));

        assertThat(pipeline.evaluate(event)).isEmpty();
    }
}
