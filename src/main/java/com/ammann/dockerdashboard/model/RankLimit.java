/* (C)2026 */
package com.ammann.dockerdashboard.model;

import com.ammann.dockerdashboard.exception.InvalidRankLimitException;

/** Number of rows shown in the top-N resource view. */
public enum RankLimit {
    TOP_3(3),
    TOP_5(5),
    TOP_10(10);

    private final int size;

    RankLimit(int size) {
        this.size = size;
    }

    public int size() {
        return size;
    }

    /**
     * Resolves a limit from its row count.
     *
     * @param size the requested number of rows
     * @return the matching limit
     * @throws InvalidRankLimitException if {@code size} is not 3, 5 or 10
     */
    public static RankLimit of(int size) {
        for (RankLimit limit : values()) {
            if (limit.size == size) {
                return limit;
            }
        }
        throw new InvalidRankLimitException(size);
    }
}
