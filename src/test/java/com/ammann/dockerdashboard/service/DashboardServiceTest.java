/* (C)2026 */
package com.ammann.dockerdashboard.service;

import static com.ammann.dockerdashboard.service.RecordFilterTest.inject;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import com.ammann.dockerdashboard.config.TestDashboardConfig;
import com.ammann.dockerdashboard.dto.CommandResult;
import com.ammann.dockerdashboard.dto.ContainerRecord;
import com.ammann.dockerdashboard.dto.DashboardSnapshot;
import com.ammann.dockerdashboard.dto.FilterState;
import com.ammann.dockerdashboard.model.StatusFilter;
import com.ammann.dockerdashboard.parser.TableParser;
import java.time.Instant;
import java.util.List;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DashboardService")
class DashboardServiceTest {

    DashboardService dashboardService;
    RecordFilter recordFilter;
    Logger logger;

    static final String PS_OUTPUT =
            "CONTAINER ID\tNAMES\tSTATUS\tPORTS\n1\tredis\tUp 2 hours\t6379/tcp";

    static final String STATS_OUTPUT =
            "NAME\tCPU %\tMEM USAGE / LIMIT\tNET I/O\n"
                    + "redis\t20.00%\t50B / 100B\t1KiB / 512B\n"
                    + "worker\t10.00%\t10B / 1000B\t--";

    @BeforeEach
    void setUp() throws Exception {
        logger = mock(Logger.class);

        TableParser tableParser = new TableParser();
        inject(tableParser, "logger", mock(Logger.class));

        SummaryAggregator summaryAggregator = new SummaryAggregator();
        inject(summaryAggregator, "config", TestDashboardConfig.defaults());

        recordFilter = spy(new RecordFilter());
        inject(recordFilter, "config", TestDashboardConfig.defaults());
        inject(recordFilter, "clock", new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
        inject(recordFilter, "logger", mock(Logger.class));
        recordFilter.init();

        dashboardService = new DashboardService();
        inject(dashboardService, "tableParser", tableParser);
        inject(dashboardService, "summaryAggregator", summaryAggregator);
        inject(dashboardService, "recordFilter", recordFilter);
        inject(dashboardService, "logger", logger);
    }

    static CommandResult result(String action, String stdout) {
        return new CommandResult(action, "docker " + action, stdout, "", 0);
    }

    @Nested
    @DisplayName("snapshot")
    class Snapshot {

        @Test
        @DisplayName("should start empty with placeholder summary")
        void shouldStartEmpty() {
            DashboardSnapshot snapshot = dashboardService.snapshot();

            assertThat(snapshot.containers()).isEmpty();
            assertThat(snapshot.summary().memUsageText()).isEqualTo("not measured");
        }
    }

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("should parse container listing and count running containers")
        void shouldParseContainerListingEndToEnd() {
            DashboardSnapshot snapshot = dashboardService.apply(result("ps", PS_OUTPUT));

            assertThat(snapshot.containers())
                    .containsExactly(new ContainerRecord("1", "redis", "Up 2 hours", "6379/tcp"));
            assertThat(snapshot.summary().totalContainers()).isEqualTo(1);
            assertThat(snapshot.summary().runningContainers()).isEqualTo(1);
            assertThat(snapshot.lastAction()).isEqualTo("ps");
            assertThat(snapshot.lastCommand()).isEqualTo("docker ps");
        }

        @Test
        @DisplayName("should clear running cache on fresh container listing")
        void shouldClearRunningCacheOnContainerListing() {
            dashboardService.apply(result("ps", PS_OUTPUT));

            verify(recordFilter).clearRunningCache();
        }

        @Test
        @DisplayName("should replace a record kind as a whole and keep others")
        void shouldReplaceRecordKindWholesale() {
            DashboardSnapshot first = dashboardService.apply(result("ps", PS_OUTPUT));
            DashboardSnapshot second =
                    dashboardService.apply(result("ps", "CONTAINER ID\tNAMES\tSTATUS\n2\tapi\tExited (0)"));
            DashboardSnapshot third = dashboardService.apply(result("stats", STATS_OUTPUT));

            assertThat(first.containers()).extracting(ContainerRecord::id).containsExactly("1");
            assertThat(second.containers()).extracting(ContainerRecord::id).containsExactly("2");
            assertThat(third.containers()).isSameAs(second.containers());
            assertThat(third.stats()).hasSize(2);
            assertThat(dashboardService.snapshot()).isSameAs(third);
        }

        @Test
        @DisplayName("should recompute weighted summary from stats")
        void shouldRecomputeWeightedSummary() {
            DashboardSnapshot snapshot = dashboardService.apply(result("stats", STATS_OUTPUT));

            assertThat(snapshot.summary().totalCpuPercent()).isEqualTo(30.0);
            assertThat(snapshot.summary().avgCpuPercent()).isEqualTo(15.0);
            assertThat(snapshot.summary().totalMemUsagePercent()).isEqualTo(60.0 / 1100 * 100);
            assertThat(snapshot.summary().netRxText()).isEqualTo("1.00 KiB");
            assertThat(snapshot.summary().netTxText()).isEqualTo("512 B");
            assertThat(snapshot.stats().get(1).netRxBytes()).isZero();
        }

        @Test
        @DisplayName("should keep first line of version and info output")
        void shouldKeepFirstLineOfVersionAndInfo() {
            dashboardService.apply(result("version", "\nDocker version 27.1.1, build 6312585\nextra"));
            DashboardSnapshot snapshot = dashboardService.apply(result("info", "   "));

            assertThat(snapshot.versionText()).isEqualTo("Docker version 27.1.1, build 6312585");
            assertThat(snapshot.infoText()).isEqualTo(DashboardService.NO_OUTPUT);
        }

        @Test
        @DisplayName("should store disk usage output verbatim")
        void shouldStoreDiskUsageOutput() {
            DashboardSnapshot snapshot =
                    dashboardService.apply(result("system_df", "TYPE  TOTAL\nImages  3"));

            assertThat(snapshot.systemDf()).isEqualTo("TYPE  TOTAL\nImages  3");
        }

        @Test
        @DisplayName("should only record last command for unknown action")
        void shouldOnlyRecordLastCommandForUnknownAction() {
            DashboardSnapshot before = dashboardService.apply(result("ps", PS_OUTPUT));

            DashboardSnapshot after = dashboardService.apply(result("restart", "redis"));

            assertThat(after.containers()).isSameAs(before.containers());
            assertThat(after.lastAction()).isEqualTo("restart");
            verify(logger).debugf(eq("Ignoring output of unknown source: %s"), eq("restart"));
        }

        @Test
        @DisplayName("should warn on failed command and still apply output")
        void shouldWarnOnFailedCommand() {
            CommandResult failed =
                    new CommandResult("images", "docker images", "", "permission denied", 1);

            DashboardSnapshot snapshot = dashboardService.apply(failed);

            assertThat(snapshot.images()).isEmpty();
            verify(logger)
                    .warnf(
                            eq("Command %s exited with code %d: %s"),
                            eq("docker images"),
                            eq(1),
                            eq("permission denied"));
        }

        @Test
        @DisplayName("should tolerate null stdout")
        void shouldTolerateNullStdout() {
            DashboardSnapshot snapshot =
                    dashboardService.apply(new CommandResult("compose_ls", "docker compose ls", null, null, 0));

            assertThat(snapshot.compose()).isEmpty();
        }
    }

    @Nested
    @DisplayName("applyBatch")
    class ApplyBatch {

        @Test
        @DisplayName("should apply results in order and feed filtering")
        void shouldApplyResultsInOrder() {
            DashboardSnapshot snapshot =
                    dashboardService.applyBatch(
                            List.of(
                                    result("ps", PS_OUTPUT),
                                    result("images", "REPOSITORY\tTAG\tIMAGE ID\tSIZE\nredis\t7\tabc\t40MB"),
                                    result("compose_ls", "NAME\tSTATUS\tCONFIG FILES\ncache\trunning(1)\tc.yml")));

            assertThat(snapshot.summary().totalImages()).isEqualTo(1);
            assertThat(snapshot.summary().composeProjects()).isEqualTo(1);
            assertThat(
                            recordFilter.filterContainers(
                                    snapshot.containers(), new FilterState("", StatusFilter.RUNNING)))
                    .hasSize(1);
        }
    }

    @Nested
    @DisplayName("reset")
    class Reset {

        @Test
        @DisplayName("should drop records and clear caches")
        void shouldDropRecordsAndClearCaches() {
            dashboardService.apply(result("ps", PS_OUTPUT));

            dashboardService.reset();

            assertThat(dashboardService.snapshot().containers()).isEmpty();
            verify(logger).info("Dashboard state reset");
            verify(recordFilter, org.mockito.Mockito.times(2)).clearRunningCache();
        }
    }
}
