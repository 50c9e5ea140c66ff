/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.criteria;

import com.dirserve.library.LibrarySearch;
import com.dirserve.library.SearchTable;
import com.dirserve.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decodes UPnP SortCriteria ({@code +dc:title,-upnp:album}) into SQL order terms.
 *
 * <p>Terms without a direction sign, unknown properties, and audio-only properties
 * against video or image tables are dropped. The caller decides whether an empty
 * result is an error.
 */
public class SortCriteriaDecoder {

    public SortClause decode(String criteria, SearchTable table) {
        if (criteria == null || criteria.isBlank()) {
            return new SortClause("", Set.of());
        }

        List<String> terms = new ArrayList<>();
        Set<Character> tags = new LinkedHashSet<>();
        String prefix = table.getTableName() + ".";
        boolean tracks = table == SearchTable.TRACKS;

        for (String raw : criteria.split(",")) {
            String term = raw.trim();
            if (term.length() < 2 || (term.charAt(0) != '+' && term.charAt(0) != '-')) {
                LoggerUtil.debug(() -> "[SortCriteriaDecoder] Dropping unsigned sort term: " + term);
                continue;
            }
            String direction = term.charAt(0) == '+' ? "ASC" : "DESC";
            String property = term.substring(1);

            String column = switch (property) {
                case "dc:title" -> prefix + "titlesort";
                case "dc:creator", "upnp:artist" -> tracks ? tag(tags, LibrarySearch.TAG_ARTIST, "contributors.namesort") : null;
                case "upnp:album" -> tracks ? tag(tags, LibrarySearch.TAG_ALBUM, "albums.titlesort") : null;
                case "upnp:genre" -> tracks ? tag(tags, LibrarySearch.TAG_GENRE, "genres.namesort") : null;
                case "upnp:originalTrackNumber" -> tracks ? "tracks.tracknum" : null;
                case "dc:date", "pv:modificationTime" -> prefix + (tracks ? "timestamp" : "mtime");
                case "pv:addedTime" -> prefix + "added_time";
                case "pv:lastUpdated" -> prefix + "updated_time";
                default -> null;
            };

            if (column == null) {
                LoggerUtil.debug(() -> "[SortCriteriaDecoder] Dropping unsupported sort property: " + property);
                continue;
            }
            terms.add(column + " " + direction);
        }

        return new SortClause(String.join(", ", terms), tags);
    }

    private static String tag(Set<Character> tags, char tag, String column) {
        tags.add(tag);
        return column;
    }
}
