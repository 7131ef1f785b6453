/* (C)2026 */
package com.ammann.dockerdashboard.dto;

/**
 * Parsed {@code "<used> / <limit>"} memory text.
 *
 * @param usedBytes    the used bytes, or {@code null} if unparseable
 * @param limitBytes   the limit in bytes, or {@code null} if unparseable
 * @param usagePercent the usage in percent, or {@code null} unless both sides parsed and the limit is positive
 */
public record MemoryUsage(Double usedBytes, Double limitBytes, Double usagePercent) {

    public static MemoryUsage unknown() {
        return new MemoryUsage(null, null, null);
    }
}
