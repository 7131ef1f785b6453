/* (C)2026 */
package com.ammann.dockerdashboard.exception;

/**
 * Runtime exception thrown when a top-N view is requested with an unsupported row count.
 *
 * <p>The resource ranking only offers 3, 5 or 10 rows; see
 * {@link com.ammann.dockerdashboard.model.RankLimit}.
 */
public class InvalidRankLimitException extends RuntimeException {

    private final int requestedLimit;

    /**
     * Constructs a new exception for the given row count.
     *
     * @param requestedLimit the rejected number of rows
     */
    public InvalidRankLimitException(int requestedLimit) {
        super("Unsupported top-N limit (expected 3, 5 or 10): " + requestedLimit);
        this.requestedLimit = requestedLimit;
    }

    /**
     * Returns the rejected number of rows.
     *
     * @return the requested limit
     */
    public int getRequestedLimit() {
        return requestedLimit;
    }
}
