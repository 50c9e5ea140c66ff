/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library;

/**
 * A window into an ordered result list.
 *
 * @param start zero-based index of the first row
 * @param limit maximum number of rows; {@link #UNBOUNDED} for no limit
 */
public record PageWindow(int start, int limit) {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    /** The single-row window used for metadata lookups. */
    public static final PageWindow SINGLE = new PageWindow(0, 1);

    public PageWindow {
        if (start < 0) {
            throw new IllegalArgumentException("start must not be negative: " + start);
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
    }

    /**
     * Builds a window from UPnP StartingIndex/RequestedCount, where a requested
     * count of zero means "all remaining".
     */
    public static PageWindow of(long startingIndex, long requestedCount) {
        int start = (int) Math.max(0, Math.min(startingIndex, Integer.MAX_VALUE));
        int limit = requestedCount <= 0 || requestedCount >= UNBOUNDED ? UNBOUNDED : (int) requestedCount;
        return new PageWindow(start, limit);
    }

    public boolean isUnbounded() {
        return limit == UNBOUNDED;
    }

    /**
     * Returns a window with the limit lowered to at most {@code max}.
     */
    public PageWindow clampLimit(int max) {
        return limit > max ? new PageWindow(start, max) : this;
    }

    /**
     * Number of rows this window selects from a list of {@code total} rows.
     */
    public int countWithin(int total) {
        int remaining = Math.max(0, total - start);
        return Math.min(limit, remaining);
    }

    /** Limit in SQLite's dialect, where -1 means no limit. */
    public int sqlLimit() {
        return isUnbounded() ? -1 : limit;
    }
}
