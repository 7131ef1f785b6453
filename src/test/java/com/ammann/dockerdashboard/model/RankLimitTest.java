/* (C)2026 */
package com.ammann.dockerdashboard.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.dockerdashboard.exception.InvalidRankLimitException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RankLimit")
class RankLimitTest {

    @Test
    @DisplayName("should resolve supported row counts")
    void shouldResolveSupportedRowCounts() {
        assertThat(RankLimit.of(3)).isEqualTo(RankLimit.TOP_3);
        assertThat(RankLimit.of(5)).isEqualTo(RankLimit.TOP_5);
        assertThat(RankLimit.of(10)).isEqualTo(RankLimit.TOP_10);
        assertThat(RankLimit.TOP_10.size()).isEqualTo(10);
    }

    @Test
    @DisplayName("should reject unsupported row count")
    void shouldRejectUnsupportedRowCount() {
        assertThatThrownBy(() -> RankLimit.of(4))
                .isInstanceOf(InvalidRankLimitException.class)
                .hasMessageContaining("4");
    }
}
