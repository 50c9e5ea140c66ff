/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library;

import com.dirserve.library.LibraryRows.TrackRow;

import java.util.Collection;
import java.util.Map;

/**
 * Query interface of the music/video/picture library backing the content directory.
 *
 * <p>Implementations throw {@link LibraryException} when a query cannot be executed.
 */
public interface MediaLibrary {

    /**
     * Runs a named browse query and returns the rows inside its page window plus the
     * un-paginated count.
     */
    LibraryResult execute(LibraryQuery query);

    /**
     * Runs a decoded search. The result uses the command of the searched table.
     */
    LibraryResult search(LibrarySearch search);

    /**
     * Batched lookup of full track rows, keyed by track id. Ids that no longer
     * exist are absent from the map.
     */
    Map<Long, TrackRow> trackDetails(Collection<Long> trackIds);

    /**
     * Completion time of the last library scan in epoch seconds, 0 if never scanned.
     */
    long lastScanTime();
}
