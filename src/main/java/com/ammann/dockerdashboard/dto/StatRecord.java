/* (C)2026 */
package com.ammann.dockerdashboard.dto;

/**
 * One resource usage sample of a container.
 *
 * <p>Memory figures are {@code null} when the sample did not carry a usable value. Network
 * figures are never {@code null}: missing traffic counters mean no traffic.
 *
 * @param name            the container name, identity of the sample
 * @param cpuPercent      the CPU usage in percent
 * @param cpuText         the CPU text as printed
 * @param memUsageText    the memory usage text, {@code "<used> / <limit>"}
 * @param memUsedBytes    the used memory in bytes, or {@code null}
 * @param memLimitBytes   the memory limit in bytes, or {@code null}
 * @param memUsagePercent used divided by limit in percent, or {@code null} without a positive limit
 * @param netIoText       the network I/O text, {@code "<rx> / <tx>"}
 * @param netRxBytes      the received bytes
 * @param netTxBytes      the transmitted bytes
 */
public record StatRecord(
        String name,
        double cpuPercent,
        String cpuText,
        String memUsageText,
        Double memUsedBytes,
        Double memLimitBytes,
        Double memUsagePercent,
        String netIoText,
        double netRxBytes,
        double netTxBytes) {

    public double netTotalBytes() {
        return netRxBytes + netTxBytes;
    }
}
