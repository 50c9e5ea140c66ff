/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

import com.dirserve.library.LibraryQuery;

/**
 * A Browse request resolved to a backend query.
 *
 * @param query      the library query, or null when the request has no rows by construction
 *                   (children of an item)
 * @param template   how to render the rows
 * @param nativeSort the only sort the query honours, null if it advertises none
 * @param totalCap   upper bound applied to the reported total
 */
public record TranslatedQuery(LibraryQuery query, RowTemplate template, String nativeSort, int totalCap) {

    public static final String TITLE_SORT = "+dc:title";
    public static final String TRACK_NUMBER_SORT = "+upnp:originalTrackNumber";

    public static TranslatedQuery of(LibraryQuery query, RowTemplate template) {
        return new TranslatedQuery(query, template, null, Integer.MAX_VALUE);
    }

    public static TranslatedQuery sorted(LibraryQuery query, RowTemplate template, String nativeSort) {
        return new TranslatedQuery(query, template, nativeSort, Integer.MAX_VALUE);
    }

    public static TranslatedQuery noRows(RowTemplate template) {
        return new TranslatedQuery(null, template, null, Integer.MAX_VALUE);
    }

    public boolean hasQuery() {
        return query != null;
    }
}
