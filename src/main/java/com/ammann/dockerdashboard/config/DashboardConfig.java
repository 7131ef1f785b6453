/* (C)2026 */
package com.ammann.dockerdashboard.config;

import com.ammann.dockerdashboard.model.RankDimension;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import java.time.Duration;

/**
 * Configuration mapping for the dashboard core.
 *
 * <p>All values are sourced from properties under the {@code dashboard} prefix and fall back
 * to the defaults below when absent.
 */
@ConfigMapping(prefix = "dashboard")
public interface DashboardConfig {

    /** Settings for the running-container classification cache. */
    @WithName("running-cache")
    RunningCache runningCache();

    /** Settings for the aggregated resource summary. */
    Summary summary();

    /** Settings for the top-N resource ranking. */
    Rank rank();

    interface RunningCache {

        /**
         * Returns how long a running-set classification may be reused for the same
         * container list instance.
         *
         * @return the reuse window in milliseconds
         */
        @WithName("ttl-millis")
        @WithDefault("3000")
        long ttlMillis();

        default Duration ttl() {
            return Duration.ofMillis(ttlMillis());
        }
    }

    interface Summary {

        /**
         * Returns the text shown for memory and network totals that have not been sampled.
         *
         * @return the placeholder text
         */
        @WithDefault("not measured")
        String placeholder();
    }

    interface Rank {

        @WithName("default-dimension")
        @WithDefault("cpu")
        RankDimension defaultDimension();

        @WithName("default-limit")
        @WithDefault("5")
        int defaultLimit();

        /** Percentage at or above which a row is classified as a warning. */
        @WithName("warn-threshold")
        @WithDefault("60")
        double warnThreshold();

        /** Percentage at or above which a row is classified as critical. */
        @WithName("danger-threshold")
        @WithDefault("85")
        double dangerThreshold();
    }
}
