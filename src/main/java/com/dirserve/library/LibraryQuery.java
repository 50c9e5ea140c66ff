/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A browse query against the library: command, page window and filter/sort parameters.
 *
 * <p>Parameters are plain strings keyed by the constants below so the query can be
 * logged in the same shape it is executed.
 */
public record LibraryQuery(LibraryCommand command, PageWindow page, Map<String, String> params) {

    public static final String ARTIST_ID = "artist_id";
    public static final String ALBUM_ID = "album_id";
    public static final String GENRE_ID = "genre_id";
    public static final String YEAR = "year";
    public static final String TRACK_ID = "track_id";
    public static final String FOLDER_ID = "folder_id";
    public static final String RETURN_TOP = "return_top";
    public static final String PLAYLIST_ID = "playlist_id";
    public static final String VIDEO_ID = "video_id";
    public static final String IMAGE_ID = "image_id";
    public static final String SORT = "sort";
    public static final String TIMELINE = "timeline";
    public static final String ALBUM = "album";
    public static final String SEARCH = "search";
    public static final String GROUP = "group";

    public static final String SORT_ALBUM = "album";
    public static final String SORT_NEW = "new";
    public static final String SORT_TRACKNUM = "tracknum";

    public LibraryQuery {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static Builder builder(LibraryCommand command, PageWindow page) {
        return new Builder(command, page);
    }

    public Optional<String> param(String key) {
        return Optional.ofNullable(params.get(key));
    }

    public boolean hasParam(String key) {
        return params.containsKey(key);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(command.getCommandName())
            .append(' ').append(page.start())
            .append(' ').append(page.isUnbounded() ? "all" : String.valueOf(page.limit()));
        params.forEach((k, v) -> sb.append(' ').append(k).append(':').append(v));
        return sb.toString();
    }

    public static final class Builder {
        private final LibraryCommand command;
        private final PageWindow page;
        private final Map<String, String> params = new LinkedHashMap<>();

        private Builder(LibraryCommand command, PageWindow page) {
            this.command = command;
            this.page = page;
        }

        public Builder param(String key, Object value) {
            params.put(key, String.valueOf(value));
            return this;
        }

        public LibraryQuery build() {
            return new LibraryQuery(command, page, params);
        }
    }
}
