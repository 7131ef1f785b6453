/* (C)2026 */
package com.ammann.dockerdashboard.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InvalidRankLimitException")
class InvalidRankLimitExceptionTest {

    @Test
    @DisplayName("should create exception with requested limit")
    void shouldCreateExceptionWithRequestedLimit() {
        InvalidRankLimitException exception = new InvalidRankLimitException(7);

        assertThat(exception.getRequestedLimit()).isEqualTo(7);
        assertThat(exception.getMessage())
                .isEqualTo("Unsupported top-N limit (expected 3, 5 or 10): 7");
    }

    @Test
    @DisplayName("should be a RuntimeException")
    void shouldBeRuntimeException() {
        InvalidRankLimitException exception = new InvalidRankLimitException(0);

        assertThat(exception).isInstanceOf(RuntimeException.class);
    }
}
