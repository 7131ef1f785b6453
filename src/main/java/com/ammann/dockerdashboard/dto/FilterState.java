/* (C)2026 */
package com.ammann.dockerdashboard.dto;

import com.ammann.dockerdashboard.model.StatusFilter;
import java.util.Locale;

/**
 * Free-text search and container state filter of the dashboard.
 *
 * @param search the search text, matched case-insensitively as a substring
 * @param status the container state filter
 */
public record FilterState(String search, StatusFilter status) {

    public FilterState {
        search = search == null ? "" : search;
        status = status == null ? StatusFilter.ALL : status;
    }

    public static FilterState all() {
        return new FilterState("", StatusFilter.ALL);
    }

    /** Returns the trimmed, lower-cased search text. */
    public String normalizedSearch() {
        return search.trim().toLowerCase(Locale.ROOT);
    }
}
