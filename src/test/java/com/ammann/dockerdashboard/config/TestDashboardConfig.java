/* (C)2026 */
package com.ammann.dockerdashboard.config;

import com.ammann.dockerdashboard.model.RankDimension;

/** Hand-built {@link DashboardConfig} carrying the production defaults. */
public final class TestDashboardConfig {

    private TestDashboardConfig() {}

    public static DashboardConfig defaults() {
        return create(3000, "not measured", RankDimension.CPU, 5);
    }

    public static DashboardConfig create(
            long ttlMillis, String placeholder, RankDimension dimension, int limit) {
        return new DashboardConfig() {
            @Override
            public RunningCache runningCache() {
                return () -> ttlMillis;
            }

            @Override
            public Summary summary() {
                return () -> placeholder;
            }

            @Override
            public Rank rank() {
                return new Rank() {
                    @Override
                    public RankDimension defaultDimension() {
                        return dimension;
                    }

                    @Override
                    public int defaultLimit() {
                        return limit;
                    }

                    @Override
                    public double warnThreshold() {
                        return 60;
                    }

                    @Override
                    public double dangerThreshold() {
                        return 85;
                    }
                };
            }
        };
    }
}
