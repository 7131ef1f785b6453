/* (C)2026 */
package com.ammann.dockerdashboard.service;

import com.ammann.dockerdashboard.config.DashboardConfig;
import com.ammann.dockerdashboard.dto.ComposeRecord;
import com.ammann.dockerdashboard.dto.ContainerRecord;
import com.ammann.dockerdashboard.dto.DashboardSnapshot;
import com.ammann.dockerdashboard.dto.ImageRecord;
import com.ammann.dockerdashboard.dto.ResourceSummary;
import com.ammann.dockerdashboard.dto.StatRecord;
import com.ammann.dockerdashboard.parser.UnitConverter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;

/**
 * Computes the dashboard totals from the complete, unfiltered record lists.
 *
 * <p>The overall memory percentage is weighted by limit: it is the sum of used bytes over the
 * sum of limits, not the mean of the per-container percentages. A container with a 16 GiB
 * limit therefore counts more than one with 256 MiB.
 */
@ApplicationScoped
public class SummaryAggregator {

    @Inject DashboardConfig config;

    /**
     * Summarizes the record lists of a snapshot. The snapshot's own summary is ignored.
     *
     * @param snapshot the snapshot to summarize
     * @return the derived summary
     */
    public ResourceSummary summarize(DashboardSnapshot snapshot) {
        return summarize(
                snapshot.containers(), snapshot.images(), snapshot.stats(), snapshot.compose());
    }

    /**
     * Summarizes the given record lists.
     *
     * @param containers all containers
     * @param images     all images
     * @param stats      all resource samples
     * @param compose    all compose projects
     * @return the derived summary
     */
    public ResourceSummary summarize(
            List<ContainerRecord> containers,
            List<ImageRecord> images,
            List<StatRecord> stats,
            List<ComposeRecord> compose) {
        int running = (int) containers.stream().filter(ContainerRecord::isRunning).count();

        double totalCpu = 0;
        double totalMemUsed = 0;
        double totalMemLimit = 0;
        double totalRx = 0;
        double totalTx = 0;
        for (StatRecord stat : stats) {
            totalCpu += stat.cpuPercent();
            totalMemUsed += stat.memUsedBytes() == null ? 0 : stat.memUsedBytes();
            totalMemLimit += stat.memLimitBytes() == null ? 0 : stat.memLimitBytes();
            totalRx += stat.netRxBytes();
            totalTx += stat.netTxBytes();
        }

        double avgCpu = stats.isEmpty() ? 0 : totalCpu / stats.size();
        Double totalMemPercent = totalMemLimit > 0 ? totalMemUsed / totalMemLimit * 100 : null;

        String placeholder = config.summary().placeholder();
        String memText =
                totalMemLimit > 0
                        ? UnitConverter.formatBytes(totalMemUsed)
                                + " / "
                                + UnitConverter.formatBytes(totalMemLimit)
                        : placeholder;

        return new ResourceSummary(
                containers.size(),
                running,
                images.size(),
                compose.size(),
                totalCpu,
                avgCpu,
                totalMemPercent,
                memText,
                totalRx > 0 ? UnitConverter.formatBytes(totalRx) : placeholder,
                totalTx > 0 ? UnitConverter.formatBytes(totalTx) : placeholder);
    }

    /**
     * Returns the summary shown before any record has been loaded.
     *
     * @return a zero summary using the configured placeholder
     */
    public ResourceSummary empty() {
        return ResourceSummary.empty(config.summary().placeholder());
    }
}
