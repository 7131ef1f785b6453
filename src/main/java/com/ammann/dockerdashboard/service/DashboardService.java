/* (C)2026 */
package com.ammann.dockerdashboard.service;

import com.ammann.dockerdashboard.dto.CommandResult;
import com.ammann.dockerdashboard.dto.DashboardSnapshot;
import com.ammann.dockerdashboard.model.SourceKind;
import com.ammann.dockerdashboard.parser.TableParser;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Holds the current dashboard snapshot and folds command results into it.
 *
 * <p>Each applied result builds a complete new {@link DashboardSnapshot} in which the record
 * list of the result's source is replaced as a whole and the summary is recomputed. The new
 * snapshot is published with a single reference assignment, so readers see either the old
 * or the new state, never a mix.
 *
 * <p>Applying a result never throws for malformed output; unparseable rows degrade as
 * described on {@link TableParser}.
 */
@ApplicationScoped
public class DashboardService {

    static final String NO_OUTPUT = "(no output)";

    @Inject TableParser tableParser;

    @Inject SummaryAggregator summaryAggregator;

    @Inject RecordFilter recordFilter;

    @Inject Logger logger;

    private volatile DashboardSnapshot current;

    /**
     * Returns the current snapshot.
     *
     * @return the latest published snapshot, empty before the first result
     */
    public DashboardSnapshot snapshot() {
        DashboardSnapshot snapshot = current;
        if (snapshot == null) {
            snapshot = DashboardSnapshot.empty(summaryAggregator.empty());
            current = snapshot;
        }
        return snapshot;
    }

    /**
     * Applies the results of one refresh batch in order.
     *
     * @param results the command results
     * @return the snapshot after the last result
     */
    public DashboardSnapshot applyBatch(List<CommandResult> results) {
        DashboardSnapshot snapshot = snapshot();
        for (CommandResult result : results) {
            snapshot = apply(result);
        }
        return snapshot;
    }

    /**
     * Folds one command result into a new snapshot and publishes it.
     *
     * <p>A fresh container listing also invalidates the running-set cache. Results with an
     * unknown action only update the last-command fields.
     *
     * @param result the command result
     * @return the published snapshot
     */
    public DashboardSnapshot apply(CommandResult result) {
        if (!result.succeeded()) {
            logger.warnf(
                    "Command %s exited with code %d: %s",
                    result.command(), result.exitCode(), result.stderr());
        }

        DashboardSnapshot next =
                snapshot().withLastCommand(result.action(), result.command());
        Optional<SourceKind> source = SourceKind.fromAction(result.action());
        if (source.isEmpty()) {
            logger.debugf("Ignoring output of unknown source: %s", result.action());
            current = next;
            return next;
        }

        String stdout = result.stdout() == null ? "" : result.stdout();
        next =
                switch (source.get()) {
                    case VERSION -> next.withVersionText(firstLineOrPlaceholder(stdout));
                    case INFO -> next.withInfoText(firstLineOrPlaceholder(stdout));
                    case PS -> {
                        recordFilter.clearRunningCache();
                        yield next.withContainers(tableParser.parseContainers(stdout));
                    }
                    case IMAGES -> next.withImages(tableParser.parseImages(stdout));
                    case STATS -> next.withStats(tableParser.parseStats(stdout));
                    case COMPOSE_LS -> next.withCompose(tableParser.parseCompose(stdout));
                    case SYSTEM_DF -> next.withSystemDf(stdout.isEmpty() ? NO_OUTPUT : stdout);
                };
        next = next.withSummary(summaryAggregator.summarize(next));

        current = next;
        logger.debugf("Applied %s result", source.get().action());
        return next;
    }

    /** Discards all records and cached classifications. */
    public void reset() {
        recordFilter.clearRunningCache();
        current = DashboardSnapshot.empty(summaryAggregator.empty());
        logger.info("Dashboard state reset");
    }

    private static String firstLineOrPlaceholder(String stdout) {
        return TableParser.firstMeaningfulLine(stdout).orElse(NO_OUTPUT);
    }
}
