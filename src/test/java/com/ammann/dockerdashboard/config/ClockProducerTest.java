/* (C)2026 */
package com.ammann.dockerdashboard.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ClockProducer")
class ClockProducerTest {

    @Test
    @DisplayName("should produce a UTC system clock")
    void shouldProduceUtcSystemClock() {
        ClockProducer producer = new ClockProducer();

        Clock clock = producer.clock();

        assertThat(clock).isNotNull();
        assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    @DisplayName("should produce a clock that advances")
    void shouldProduceClockThatAdvances() {
        Clock clock = new ClockProducer().clock();

        long first = clock.millis();

        assertThat(clock.millis()).isGreaterThanOrEqualTo(first);
    }
}
