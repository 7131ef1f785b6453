/* (C)2026 */
package com.ammann.dockerdashboard.service;

import com.ammann.dockerdashboard.config.DashboardConfig;
import com.ammann.dockerdashboard.dto.RankedRow;
import com.ammann.dockerdashboard.dto.RankedView;
import com.ammann.dockerdashboard.dto.RowInstruction;
import com.ammann.dockerdashboard.dto.StatRecord;
import com.ammann.dockerdashboard.model.RankDimension;
import com.ammann.dockerdashboard.model.RankLimit;
import com.ammann.dockerdashboard.model.UsageLevel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Ranks resource samples for the top-N usage view and reconciles the displayed rows.
 *
 * <p>Ranking is a stable descending sort, so samples with equal values keep their listing
 * order. Rows are identified by container name; {@link #reconcile(RankedView)} turns a new
 * view into add/update/remove instructions against the rows displayed so far, which lets a
 * renderer keep row elements (and their transitions) across refreshes.
 *
 * <p>A listing that contains the same name twice is collapsed to one sample per name: the
 * last sample wins, at the position of the first occurrence.
 */
@ApplicationScoped
public class RankEngine {

    private static final String UNKNOWN = "--";

    @Inject DashboardConfig config;

    @Inject Logger logger;

    private final Set<String> displayedNames = new LinkedHashSet<>();

    /**
     * Ranks samples with the configured default dimension and row count.
     *
     * @param stats the resource samples
     * @return the visible rows
     */
    public RankedView rank(List<StatRecord> stats) {
        return rank(
                stats,
                config.rank().defaultDimension(),
                RankLimit.of(config.rank().defaultLimit()));
    }

    /**
     * Sorts samples by a dimension and keeps the first {@code limit} of them.
     *
     * <p>For {@link RankDimension#MEM} a sample without a memory percentage ranks as 0. For
     * {@link RankDimension#NET} bar widths are relative to the largest rx+tx among the
     * visible rows, not among all samples.
     *
     * @param stats     the resource samples
     * @param dimension the sort dimension
     * @param limit     the number of visible rows
     * @return the visible rows, highest first
     */
    public RankedView rank(List<StatRecord> stats, RankDimension dimension, RankLimit limit) {
        Objects.requireNonNull(dimension, "dimension");
        Objects.requireNonNull(limit, "limit");

        Collection<StatRecord> unique = deduplicate(stats);
        List<StatRecord> sorted = new ArrayList<>(unique);
        sorted.sort(Comparator.comparingDouble((StatRecord s) -> sortKey(s, dimension)).reversed());
        List<StatRecord> visible = sorted.subList(0, Math.min(limit.size(), sorted.size()));

        double maxNet = 0;
        for (StatRecord stat : visible) {
            maxNet = Math.max(maxNet, stat.netTotalBytes());
        }

        List<RankedRow> rows = new ArrayList<>(visible.size());
        for (StatRecord stat : visible) {
            rows.add(toRow(stat, dimension, maxNet));
        }
        return new RankedView(dimension, limit, rows, unique.size());
    }

    /**
     * Computes the changes that turn the displayed rows into {@code view} and records the
     * view's rows as displayed.
     *
     * <p>Removals come first, followed by one update or add per visible row in rank order.
     *
     * @param view the newly ranked view
     * @return the instructions for the renderer
     */
    public List<RowInstruction> reconcile(RankedView view) {
        Set<String> visibleNames = new LinkedHashSet<>();
        for (RankedRow row : view.rows()) {
            visibleNames.add(row.name());
        }

        List<RowInstruction> instructions = new ArrayList<>();
        for (String name : displayedNames) {
            if (!visibleNames.contains(name)) {
                instructions.add(RowInstruction.remove(name));
            }
        }
        for (RankedRow row : view.rows()) {
            instructions.add(
                    displayedNames.contains(row.name())
                            ? RowInstruction.update(row)
                            : RowInstruction.add(row));
        }

        displayedNames.clear();
        displayedNames.addAll(visibleNames);
        logger.debugf(
                "Reconciled %s %s view: %d instructions",
                view.limit(), view.dimension(), instructions.size());
        return instructions;
    }

    /** Returns the names of the rows currently displayed, in rank order. */
    public List<String> displayedNames() {
        return List.copyOf(displayedNames);
    }

    /** Forgets the displayed rows; the next reconciliation adds every row. */
    public void reset() {
        displayedNames.clear();
    }

    static double sortKey(StatRecord stat, RankDimension dimension) {
        return switch (dimension) {
            case CPU -> stat.cpuPercent();
            case MEM -> stat.memUsagePercent() == null ? 0 : stat.memUsagePercent();
            case NET -> stat.netTotalBytes();
        };
    }

    private RankedRow toRow(StatRecord stat, RankDimension dimension, double maxNet) {
        double barPercent =
                switch (dimension) {
                    case CPU -> clamp(stat.cpuPercent());
                    case MEM -> clamp(stat.memUsagePercent() == null ? 0 : stat.memUsagePercent());
                    case NET -> maxNet > 0 ? stat.netTotalBytes() / maxNet * 100 : 0;
                };
        UsageLevel level = dimension == RankDimension.NET ? UsageLevel.OK : levelOf(barPercent);
        return new RankedRow(stat, barPercent, label(stat, dimension), level, tooltip(stat));
    }

    private UsageLevel levelOf(double percent) {
        if (percent >= config.rank().dangerThreshold()) {
            return UsageLevel.DANGER;
        }
        if (percent >= config.rank().warnThreshold()) {
            return UsageLevel.WARN;
        }
        return UsageLevel.OK;
    }

    private static String label(StatRecord stat, RankDimension dimension) {
        return switch (dimension) {
            case CPU -> stat.cpuText();
            case MEM -> usedPart(stat.memUsageText()) + " (" + formatPercent(stat.memUsagePercent()) + ")";
            case NET -> stat.netIoText();
        };
    }

    private static String tooltip(StatRecord stat) {
        return "CPU: "
                + stat.cpuText()
                + " | MEM: "
                + stat.memUsageText()
                + " ("
                + formatPercent(stat.memUsagePercent())
                + ") | NET: "
                + stat.netIoText();
    }

    private static String usedPart(String memUsageText) {
        if (memUsageText == null) {
            return UNKNOWN;
        }
        String used = memUsageText.split("/")[0].trim();
        return used.isEmpty() ? UNKNOWN : used;
    }

    private static String formatPercent(Double percent) {
        return percent == null ? UNKNOWN : String.format(Locale.ROOT, "%.1f%%", percent);
    }

    private static double clamp(double percent) {
        return Math.max(0, Math.min(100, percent));
    }

    private static Collection<StatRecord> deduplicate(List<StatRecord> stats) {
        Map<String, StatRecord> byName = new LinkedHashMap<>();
        for (StatRecord stat : stats) {
            byName.put(stat.name(), stat);
        }
        return byName.values();
    }
}
