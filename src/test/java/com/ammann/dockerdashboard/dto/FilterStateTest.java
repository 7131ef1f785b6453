/* (C)2026 */
package com.ammann.dockerdashboard.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.dockerdashboard.model.StatusFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FilterState")
class FilterStateTest {

    @Test
    @DisplayName("should default null values")
    void shouldDefaultNullValues() {
        FilterState state = new FilterState(null, null);

        assertThat(state.search()).isEmpty();
        assertThat(state.status()).isEqualTo(StatusFilter.ALL);
        assertThat(state).isEqualTo(FilterState.all());
    }

    @Test
    @DisplayName("should normalize search text")
    void shouldNormalizeSearchText() {
        assertThat(new FilterState("  ReDiS ", StatusFilter.RUNNING).normalizedSearch())
                .isEqualTo("redis");
    }
}
