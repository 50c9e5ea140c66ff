/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A decoded search against one table family.
 *
 * @param table      table family to search
 * @param predicate  SQL predicate using table-qualified columns and {@code ?} placeholders
 * @param parameters values bound to the placeholders, in order
 * @param orderBy    SQL order clause without the ORDER BY keyword, empty for natural order
 * @param tags       extra data the rows must carry ({@code a} artist, {@code l} album,
 *                   {@code g} genre, {@code U} update time)
 * @param page       page window
 */
public record LibrarySearch(
    SearchTable table,
    String predicate,
    List<Object> parameters,
    String orderBy,
    Set<Character> tags,
    PageWindow page
) {

    public static final char TAG_ARTIST = 'a';
    public static final char TAG_ALBUM = 'l';
    public static final char TAG_GENRE = 'g';
    public static final char TAG_UPDATED = 'U';

    public LibrarySearch {
        parameters = List.copyOf(parameters);
        tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        orderBy = orderBy == null ? "" : orderBy;
    }

    public boolean hasTag(char tag) {
        return tags.contains(tag);
    }
}
