/* (C)2026 */
package com.ammann.dockerdashboard.dto;

import com.ammann.dockerdashboard.model.RankDimension;
import com.ammann.dockerdashboard.model.RankLimit;
import java.util.List;

/**
 * The visible part of the top-N resource view.
 *
 * @param dimension  the sort dimension
 * @param limit      the requested row count
 * @param rows       the visible rows, highest first
 * @param totalCount the number of samples ranked
 */
public record RankedView(
        RankDimension dimension, RankLimit limit, List<RankedRow> rows, int totalCount) {

    public RankedView {
        rows = List.copyOf(rows);
    }

    /** Number of samples that did not make it into the visible rows. */
    public int hiddenCount() {
        return totalCount - rows.size();
    }
}
