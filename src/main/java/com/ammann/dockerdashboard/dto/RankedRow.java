/* (C)2026 */
package com.ammann.dockerdashboard.dto;

import com.ammann.dockerdashboard.model.UsageLevel;

/**
 * Display data of one visible row in the top-N resource view.
 *
 * @param record     the underlying sample
 * @param barPercent the bar width in percent, 0 to 100
 * @param label      the value text for the active dimension
 * @param level      the severity class of the bar
 * @param tooltip    the all-dimension tooltip text
 */
public record RankedRow(
        StatRecord record, double barPercent, String label, UsageLevel level, String tooltip) {

    public String name() {
        return record.name();
    }
}
