/* (C)2026 */
package com.ammann.dockerdashboard.dto;

import java.util.List;

/**
 * Immutable state of the dashboard after a refresh step.
 *
 * <p>Each record list is an unmodifiable copy and is only ever replaced as a whole, so a
 * reader holding a snapshot never sees rows from two different refreshes within one kind.
 *
 * @param containers  the container listing
 * @param images      the image listing
 * @param stats       the resource usage samples
 * @param compose     the compose projects
 * @param summary     the totals derived from the four lists
 * @param versionText the first line of the version output
 * @param infoText    the first line of the info output
 * @param systemDf    the disk usage output
 * @param lastAction  the source label of the last applied result
 * @param lastCommand the command line of the last applied result
 */
public record DashboardSnapshot(
        List<ContainerRecord> containers,
        List<ImageRecord> images,
        List<StatRecord> stats,
        List<ComposeRecord> compose,
        ResourceSummary summary,
        String versionText,
        String infoText,
        String systemDf,
        String lastAction,
        String lastCommand) {

    public DashboardSnapshot {
        containers = List.copyOf(containers);
        images = List.copyOf(images);
        stats = List.copyOf(stats);
        compose = List.copyOf(compose);
    }

    /**
     * Creates the snapshot shown before the first refresh.
     *
     * @param summary the empty summary
     * @return a snapshot without records
     */
    public static DashboardSnapshot empty(ResourceSummary summary) {
        return new DashboardSnapshot(
                List.of(), List.of(), List.of(), List.of(), summary, "", "", "", "", "");
    }

    public DashboardSnapshot withContainers(List<ContainerRecord> value) {
        return new DashboardSnapshot(
                value, images, stats, compose, summary, versionText, infoText, systemDf,
                lastAction, lastCommand);
    }

    public DashboardSnapshot withImages(List<ImageRecord> value) {
        return new DashboardSnapshot(
                containers, value, stats, compose, summary, versionText, infoText, systemDf,
                lastAction, lastCommand);
    }

    public DashboardSnapshot withStats(List<StatRecord> value) {
        return new DashboardSnapshot(
                containers, images, value, compose, summary, versionText, infoText, systemDf,
                lastAction, lastCommand);
    }

    public DashboardSnapshot withCompose(List<ComposeRecord> value) {
        return new DashboardSnapshot(
                containers, images, stats, value, summary, versionText, infoText, systemDf,
                lastAction, lastCommand);
    }

    public DashboardSnapshot withSummary(ResourceSummary value) {
        return new DashboardSnapshot(
                containers, images, stats, compose, value, versionText, infoText, systemDf,
                lastAction, lastCommand);
    }

    public DashboardSnapshot withVersionText(String value) {
        return new DashboardSnapshot(
                containers, images, stats, compose, summary, value, infoText, systemDf,
                lastAction, lastCommand);
    }

    public DashboardSnapshot withInfoText(String value) {
        return new DashboardSnapshot(
                containers, images, stats, compose, summary, versionText, value, systemDf,
                lastAction, lastCommand);
    }

    public DashboardSnapshot withSystemDf(String value) {
        return new DashboardSnapshot(
                containers, images, stats, compose, summary, versionText, infoText, value,
                lastAction, lastCommand);
    }

    public DashboardSnapshot withLastCommand(String action, String command) {
        return new DashboardSnapshot(
                containers, images, stats, compose, summary, versionText, infoText, systemDf,
                action, command);
    }
}
