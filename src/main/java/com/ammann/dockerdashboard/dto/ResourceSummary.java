/* (C)2026 */
package com.ammann.dockerdashboard.dto;

/**
 * Dashboard-wide totals derived from one snapshot.
 *
 * @param totalContainers      number of containers
 * @param runningContainers    number of containers classified as running
 * @param totalImages          number of images
 * @param composeProjects      number of compose projects
 * @param totalCpuPercent      sum of CPU usage over all samples
 * @param avgCpuPercent        mean CPU usage per sample, 0 without samples
 * @param totalMemUsagePercent total used memory over total limit in percent, or {@code null}
 * @param memUsageText         humanized {@code "<used> / <limit>"} or the placeholder
 * @param netRxText            humanized received bytes or the placeholder
 * @param netTxText            humanized transmitted bytes or the placeholder
 */
public record ResourceSummary(
        int totalContainers,
        int runningContainers,
        int totalImages,
        int composeProjects,
        double totalCpuPercent,
        double avgCpuPercent,
        Double totalMemUsagePercent,
        String memUsageText,
        String netRxText,
        String netTxText) {

    /**
     * Creates the summary shown before the first refresh.
     *
     * @param placeholder the text for unmeasured memory and network totals
     * @return a summary with zero counts
     */
    public static ResourceSummary empty(String placeholder) {
        return new ResourceSummary(0, 0, 0, 0, 0, 0, null, placeholder, placeholder, placeholder);
    }
}
