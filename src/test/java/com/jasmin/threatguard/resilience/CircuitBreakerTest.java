package com.jasmin.threatguard.resilience;

import com.jasmin.threatguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T10:00:00Z");
        breaker = new CircuitBreaker("marketplace", new CircuitBreakerConfig(3, 2, 30, 180), clock);
    }

    private void fail() {
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IllegalStateException("upstream down");
        })).isInstanceOf(IllegalStateException.class);
    }

    private void openCircuit() {
        fail();
        fail();
        fail();
    }

    @Test
    void opensAtTheFailureThreshold() {
        fail();
        fail();
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);

        fail();

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.getStats().getNextAttemptAt()).isEqualTo(clock.instant().plusSeconds(30));
    }

    @Test
    void openCircuitRejectsWithoutCallingTheAction() {
        openCircuit();
        int[] calls = {0};

        assertThatThrownBy(() -> breaker.execute(() -> ++calls[0]))
                .isInstanceOf(CircuitBreakerOpenException.class)
                .hasMessageContaining("marketplace");
        assertThat(breaker.execute(() -> ++calls[0], () -> -1)).isEqualTo(-1);
        assertThat(calls[0]).isZero();
    }

    @Test
    void halfOpenClosesAfterEnoughSuccessfulTrials() {
        openCircuit();
        clock.advance(Duration.ofSeconds(30));

        assertThat(breaker.execute(() -> "ok")).isEqualTo("ok");
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

        breaker.execute(() -> "ok");
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getStats().getFailureCount()).isZero();
    }

    @Test
    void failedTrialReopens() {
        openCircuit();
        clock.advance(Duration.ofSeconds(31));

        fail();

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.getStats().getNextAttemptAt()).isEqualTo(clock.instant().plusSeconds(30));
    }

    @Test
    void secondCallIsRejectedWhileTheHalfOpenTrialIsRunning() {
        openCircuit();
        clock.advance(Duration.ofSeconds(30));
        int[] nestedCalls = {0};

        String result = breaker.execute(() -> {
            assertThatThrownBy(() -> breaker.execute(() -> ++nestedCalls[0]))
                    .isInstanceOf(CircuitBreakerOpenException.class);
            assertThat(breaker.execute(() -> ++nestedCalls[0], () -> -1)).isEqualTo(-1);
            return "trial";
        });

        assertThat(result).isEqualTo("trial");
        assertThat(nestedCalls[0]).isZero();
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.execute(() -> "next")).isEqualTo("next");
    }

    @Test
    void errorThrownByTheTrialReopensInsteadOfWedgingTheCircuit() {
        openCircuit();
        clock.advance(Duration.ofSeconds(30));

        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new AssertionError("linkage failure");
        })).isInstanceOf(AssertionError.class);

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThatThrownBy(() -> breaker.execute(() -> "too early")).isInstanceOf(CircuitBreakerOpenException.class);

        clock.advance(Duration.ofSeconds(30));
        assertThat(breaker.execute(() -> "recovered")).isEqualTo("recovered");
    }

    @Test
    void errorInClosedStateCountsAsAFailure() {
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new StackOverflowError();
        })).isInstanceOf(StackOverflowError.class);

        assertThat(breaker.getStats().getFailureCount()).isEqualTo(1);
    }

    @Test
    void successResetsTheConsecutiveFailureCount() {
        fail();
        fail();
        breaker.execute(() -> "ok");
        fail();
        fail();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void failuresAreForgottenAfterTheResetTimeout() {
        fail();
        fail();
        clock.advance(Duration.ofSeconds(180));
        fail();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getStats().getFailureCount()).isEqualTo(1);
    }

    @Test
    void failedCallWithFallbackReturnsTheFallbackAndCounts() {
        String value = breaker.execute(() -> {
            throw new IllegalStateException("down");
        }, () -> "cached");

        assertThat(value).isEqualTo("cached");
        assertThat(breaker.getStats().getFailureCount()).isEqualTo(1);
    }

    @Test
    void manualResetCloses() {
        openCircuit();

        breaker.reset();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getStats().getNextAttemptAt()).isNull();
    }

    @Test
    void registryUsesNamedConfigAndRejectsUnknownResets() {
        ResilienceProperties props = new ResilienceProperties();
        props.getCircuitBreakers().put("alert-channel", new CircuitBreakerConfig(1, 1, 10, 60));
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(props, clock);

        assertThatThrownBy(() -> registry.get("alert-channel").run(() -> {
            throw new IllegalStateException("smtp down");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(registry.get("alert-channel").getState()).isEqualTo(CircuitState.OPEN);
        assertThat(registry.get("other").getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(registry.getAllStats()).extracting(CircuitBreakerStats::getName).containsExactly("alert-channel", "other");

        registry.reset("alert-channel");
        assertThat(registry.get("alert-channel").getState()).isEqualTo(CircuitState.CLOSED);
        assertThatThrownBy(() -> registry.reset("missing")).isInstanceOf(NoSuchElementException.class);
    }
}
