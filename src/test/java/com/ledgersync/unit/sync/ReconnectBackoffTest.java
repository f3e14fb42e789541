package com.ledgersync.unit.sync;

import static org.assertj.core.api.Assertions.assertThat;

import com.ledgersync.sync.ReconnectBackoff;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for ReconnectBackoff: doubling from the minimum, cap and reset. */
class ReconnectBackoffTest {

    @Test
    @DisplayName("Delay doubles per attempt and is capped at the maximum")
    void doublesUntilCap() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofSeconds(3), Duration.ofSeconds(60));

        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(3));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(6));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(12));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(24));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(48));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(60));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(60));
        assertThat(backoff.getAttempt()).isEqualTo(7);
    }

    @Test
    @DisplayName("Reset starts the sequence over at the minimum")
    void resetRestarts() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofSeconds(3), Duration.ofSeconds(60));
        backoff.nextDelay();
        backoff.nextDelay();

        backoff.reset();

        assertThat(backoff.getAttempt()).isZero();
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("Maximum below the minimum is raised to the minimum")
    void maxBelowMin() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofSeconds(5), Duration.ofSeconds(1));

        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofSeconds(5));
    }
}
