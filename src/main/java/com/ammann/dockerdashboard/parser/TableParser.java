/* (C)2026 */
package com.ammann.dockerdashboard.parser;

import com.ammann.dockerdashboard.dto.ComposeRecord;
import com.ammann.dockerdashboard.dto.ContainerRecord;
import com.ammann.dockerdashboard.dto.ImageRecord;
import com.ammann.dockerdashboard.dto.MemoryUsage;
import com.ammann.dockerdashboard.dto.NetworkUsage;
import com.ammann.dockerdashboard.dto.StatRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Parses the tabular output of the Docker listing commands into typed records.
 *
 * <p>Every input is expected to start with a header line, which is skipped. Columns are
 * split on tabs when the line contains more than one tab-separated value (machine output
 * produced with {@code --format "table {{...}}\t{{...}}"}); otherwise on runs of two or more
 * whitespace characters, which covers the space-padded default table layout.
 *
 * <p>Missing columns never fail a row. Text fields fall back to {@code "--"}, so a
 * malformed line only degrades that one record.
 */
@ApplicationScoped
public class TableParser {

    /** Value of a text column that is absent from a row. */
    public static final String MISSING = "--";

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private static final Pattern COLUMN_GAP = Pattern.compile("\\s{2,}");

    /** Separator used when trailing columns are folded into the last field. */
    private static final String JOIN_SEPARATOR = "  ";

    @Inject Logger logger;

    /**
     * Parses a container listing with the columns id, name, status and ports.
     *
     * @param raw the raw command output including the header line
     * @return the containers, empty if the output has no data lines
     */
    public List<ContainerRecord> parseContainers(String raw) {
        return parseRows(
                "containers",
                raw,
                columns ->
                        new ContainerRecord(
                                column(columns, 0, MISSING),
                                column(columns, 1, MISSING),
                                column(columns, 2, MISSING),
                                rest(columns, 3)));
    }

    /**
     * Parses an image listing with the columns repository, tag, id and size.
     *
     * @param raw the raw command output including the header line
     * @return the images, empty if the output has no data lines
     */
    public List<ImageRecord> parseImages(String raw) {
        return parseRows(
                "images",
                raw,
                columns ->
                        new ImageRecord(
                                column(columns, 0, MISSING),
                                column(columns, 1, MISSING),
                                column(columns, 2, MISSING),
                                rest(columns, 3)));
    }

    /**
     * Parses a stats listing with the columns name, CPU %, memory usage and network I/O.
     *
     * <p>Numeric fields are derived from the texts with {@link UnitConverter}.
     *
     * @param raw the raw command output including the header line
     * @return the samples, empty if the output has no data lines
     */
    public List<StatRecord> parseStats(String raw) {
        return parseRows("stats", raw, this::toStatRecord);
    }

    /**
     * Parses a compose project listing with the columns name, status and config files.
     *
     * @param raw the raw command output including the header line
     * @return the projects, empty if the output has no data lines
     */
    public List<ComposeRecord> parseCompose(String raw) {
        return parseRows(
                "compose projects",
                raw,
                columns ->
                        new ComposeRecord(
                                column(columns, 0, MISSING),
                                column(columns, 1, MISSING),
                                rest(columns, 2)));
    }

    /**
     * Returns the first non-blank line of a command output, trimmed.
     *
     * @param raw the raw command output, may be {@code null}
     * @return the line, or empty if the output is blank
     */
    public static Optional<String> firstMeaningfulLine(String raw) {
        return lines(raw).stream().findFirst();
    }

    private StatRecord toStatRecord(List<String> columns) {
        String cpuText = column(columns, 1, "0%");
        String memUsageText = column(columns, 2, MISSING);
        String netIoText = rest(columns, 3);
        MemoryUsage memory = UnitConverter.parseMemoryUsage(memUsageText);
        NetworkUsage network = UnitConverter.parseNetworkUsage(netIoText);

        return new StatRecord(
                column(columns, 0, MISSING),
                UnitConverter.parsePercent(cpuText),
                cpuText,
                memUsageText,
                memory.usedBytes(),
                memory.limitBytes(),
                memory.usagePercent(),
                netIoText,
                network.rxBytes(),
                network.txBytes());
    }

    private <T> List<T> parseRows(String label, String raw, Function<List<String>, T> mapper) {
        List<String> lines = lines(raw);
        if (lines.size() <= 1) {
            logger.debugf("No %s rows in output (%d meaningful lines)", label, lines.size());
            return List.of();
        }

        List<T> records = new ArrayList<>(lines.size() - 1);
        for (String line : lines.subList(1, lines.size())) {
            List<String> columns = splitColumns(line);
            if (!columns.isEmpty()) {
                records.add(mapper.apply(columns));
            }
        }
        logger.debugf("Parsed %d %s rows", records.size(), label);
        return records;
    }

    private static List<String> lines(String raw) {
        if (raw == null) {
            return List.of();
        }
        return LINE_BREAK.splitAsStream(raw).map(String::trim).filter(line -> !line.isEmpty()).toList();
    }

    static List<String> splitColumns(String line) {
        List<String> tabParts = nonEmpty(line.split("\t"));
        if (tabParts.size() > 1) {
            return tabParts;
        }
        return nonEmpty(COLUMN_GAP.split(line));
    }

    private static List<String> nonEmpty(String[] parts) {
        return Arrays.stream(parts).map(String::trim).filter(part -> !part.isEmpty()).toList();
    }

    private static String column(List<String> columns, int index, String fallback) {
        return index < columns.size() ? columns.get(index) : fallback;
    }

    private static String rest(List<String> columns, int fromIndex) {
        if (fromIndex >= columns.size()) {
            return MISSING;
        }
        return String.join(JOIN_SEPARATOR, columns.subList(fromIndex, columns.size()));
    }
}
