/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.criteria;

import com.dirserve.library.SearchTable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decoded search criteria.
 *
 * @param table      table family the criteria select
 * @param predicate  SQL predicate with {@code ?} placeholders
 * @param parameters values for the placeholders, in order
 * @param tags       joined data the predicate needs
 */
public record SearchQuery(SearchTable table, String predicate, List<Object> parameters, Set<Character> tags) {

    public SearchQuery {
        parameters = List.copyOf(parameters);
        tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    public static SearchQuery matchAll() {
        return new SearchQuery(SearchTable.TRACKS, "1=1", List.of(), Set.of());
    }
}
