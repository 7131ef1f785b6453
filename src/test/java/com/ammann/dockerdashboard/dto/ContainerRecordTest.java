/* (C)2026 */
package com.ammann.dockerdashboard.dto;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ContainerRecord")
class ContainerRecordTest {

    @Test
    @DisplayName("should create record with all fields")
    void shouldCreateRecordWithAllFields() {
        ContainerRecord record = new ContainerRecord("abc123", "redis", "Up 2 hours", "6379/tcp");

        assertThat(record.id()).isEqualTo("abc123");
        assertThat(record.name()).isEqualTo("redis");
        assertThat(record.status()).isEqualTo("Up 2 hours");
        assertThat(record.ports()).isEqualTo("6379/tcp");
    }

    @ParameterizedTest
    @ValueSource(strings = {"Up 2 hours", "UP", "running", "Up 5 seconds (healthy)"})
    @DisplayName("should classify running status texts")
    void shouldClassifyRunningStatus(String status) {
        assertThat(ContainerRecord.isRunningStatus(status)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Exited (0) 3 days ago", "Created", "", "--"})
    @DisplayName("should classify other status texts as not running")
    void shouldClassifyOtherStatus(String status) {
        assertThat(ContainerRecord.isRunningStatus(status)).isFalse();
    }

    @Test
    @DisplayName("should treat null status as not running")
    void shouldTreatNullStatusAsNotRunning() {
        assertThat(new ContainerRecord("1", "a", null, null).isRunning()).isFalse();
    }
}
