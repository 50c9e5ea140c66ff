/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

import com.dirserve.library.LibraryCommand;
import com.dirserve.library.LibraryQuery;
import com.dirserve.library.PageWindow;
import com.dirserve.utils.LoggerUtil;

/**
 * Chooses the library query that answers a Browse request for a parsed object-ID.
 *
 * <p>BrowseMetadata always asks for a single row describing the node itself.
 * BrowseDirectChildren asks for the requested page of the node's children.
 * Library queries return rows in one fixed order; a requested sort other than
 * that order is logged and ignored.
 */
public class QueryTranslator {

    public static final int DEFAULT_AGE_LIMIT = 100;

    private final int ageLimit;

    public QueryTranslator() {
        this(DEFAULT_AGE_LIMIT);
    }

    /**
     * @param ageLimit maximum number of albums listed under New Music
     */
    public QueryTranslator(int ageLimit) {
        this.ageLimit = ageLimit > 0 ? ageLimit : DEFAULT_AGE_LIMIT;
    }

    /**
     * @throws UpnpFault 701 when the node cannot be browsed in the requested mode
     */
    public TranslatedQuery translate(ObjectPath path, BrowseFlag flag, PageWindow page, String sort) {
        TranslatedQuery translated = flag == BrowseFlag.BROWSE_METADATA
            ? metadata(path)
            : children(path, page);

        if (flag == BrowseFlag.BROWSE_DIRECT_CHILDREN) {
            checkSort(path, translated, sort);
        }
        if (translated.hasQuery()) {
            LoggerUtil.debug(() -> "[QueryTranslator] " + path + " " + flag.getWireName() + " -> " + translated.query());
        }
        return translated;
    }

    private TranslatedQuery children(ObjectPath path, PageWindow page) {
        return switch (path.type()) {
            case MOUNT_ROOT -> mountChildren(path.mount(), page);
            case ARTIST -> TranslatedQuery.sorted(
                withGenre(path, LibraryQuery.builder(LibraryCommand.ALBUMS, page))
                    .param(LibraryQuery.ARTIST_ID, path.key(PathKey.ARTIST))
                    .param(LibraryQuery.SORT, LibraryQuery.SORT_ALBUM)
                    .build(),
                RowTemplate.ALBUM, TranslatedQuery.TITLE_SORT);
            case ALBUM -> TranslatedQuery.sorted(
                LibraryQuery.builder(LibraryCommand.TITLES, page)
                    .param(LibraryQuery.ALBUM_ID, path.key(PathKey.ALBUM))
                    .param(LibraryQuery.SORT, LibraryQuery.SORT_TRACKNUM)
                    .build(),
                RowTemplate.TRACK, TranslatedQuery.TRACK_NUMBER_SORT);
            case GENRE -> TranslatedQuery.sorted(
                LibraryQuery.builder(LibraryCommand.ARTISTS, page)
                    .param(LibraryQuery.GENRE_ID, path.key(PathKey.GENRE))
                    .build(),
                RowTemplate.ARTIST, TranslatedQuery.TITLE_SORT);
            case YEAR -> TranslatedQuery.sorted(
                LibraryQuery.builder(LibraryCommand.ALBUMS, page)
                    .param(LibraryQuery.YEAR, path.key(PathKey.YEAR))
                    .param(LibraryQuery.SORT, LibraryQuery.SORT_ALBUM)
                    .build(),
                RowTemplate.ALBUM, TranslatedQuery.TITLE_SORT);
            case FOLDER -> TranslatedQuery.sorted(
                LibraryQuery.builder(LibraryCommand.MUSICFOLDER, page)
                    .param(LibraryQuery.FOLDER_ID, path.key(PathKey.FOLDER))
                    .build(),
                RowTemplate.FOLDER, TranslatedQuery.TITLE_SORT);
            case PLAYLIST -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.PLAYLIST_TRACKS, page)
                    .param(LibraryQuery.PLAYLIST_ID, path.key(PathKey.PLAYLIST))
                    .build(),
                RowTemplate.TRACK);
            case IMAGE_ALBUM -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.IMAGE_TITLES, page)
                    .param(LibraryQuery.ALBUM, path.key(PathKey.IMAGE_ALBUM))
                    .build(),
                RowTemplate.IMAGE);
            case TIMELINE_YEAR -> TranslatedQuery.of(
                timeline(page, "months", path.key(PathKey.YEAR)).build(),
                RowTemplate.IMAGE_GROUP);
            case TIMELINE_MONTH -> TranslatedQuery.of(
                timeline(page, "days", path.key(PathKey.YEAR) + "-" + path.key(PathKey.MONTH)).build(),
                RowTemplate.IMAGE_GROUP);
            case TIMELINE_DAY, DATE -> TranslatedQuery.of(
                timeline(page, "day", day(path)).build(),
                RowTemplate.IMAGE);
            // Items have no children
            case TRACK -> TranslatedQuery.noRows(RowTemplate.TRACK);
            case VIDEO -> TranslatedQuery.noRows(RowTemplate.VIDEO);
            case IMAGE -> TranslatedQuery.noRows(RowTemplate.IMAGE);
        };
    }

    private TranslatedQuery mountChildren(Mount mount, PageWindow page) {
        return switch (mount) {
            case ARTISTS -> TranslatedQuery.sorted(
                LibraryQuery.builder(LibraryCommand.ARTISTS, page).build(),
                RowTemplate.ARTIST, TranslatedQuery.TITLE_SORT);
            case ALBUMS -> TranslatedQuery.sorted(
                LibraryQuery.builder(LibraryCommand.ALBUMS, page)
                    .param(LibraryQuery.SORT, LibraryQuery.SORT_ALBUM)
                    .build(),
                RowTemplate.ALBUM, TranslatedQuery.TITLE_SORT);
            case GENRES -> TranslatedQuery.sorted(
                LibraryQuery.builder(LibraryCommand.GENRES, page).build(),
                RowTemplate.GENRE, TranslatedQuery.TITLE_SORT);
            case YEARS -> TranslatedQuery.sorted(
                LibraryQuery.builder(LibraryCommand.YEARS, page).build(),
                RowTemplate.YEAR, TranslatedQuery.TITLE_SORT);
            case NEW_MUSIC -> new TranslatedQuery(
                LibraryQuery.builder(LibraryCommand.ALBUMS, page.clampLimit(ageLimit))
                    .param(LibraryQuery.SORT, LibraryQuery.SORT_NEW)
                    .build(),
                RowTemplate.ALBUM, null, ageLimit);
            case MUSIC_FOLDER -> TranslatedQuery.sorted(
                LibraryQuery.builder(LibraryCommand.MUSICFOLDER, page).build(),
                RowTemplate.FOLDER, TranslatedQuery.TITLE_SORT);
            case PLAYLISTS -> TranslatedQuery.sorted(
                LibraryQuery.builder(LibraryCommand.PLAYLISTS, page).build(),
                RowTemplate.PLAYLIST, TranslatedQuery.TITLE_SORT);
            case ALL_VIDEOS -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.VIDEO_TITLES, page).build(),
                RowTemplate.VIDEO);
            case ALL_IMAGES -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.IMAGE_TITLES, page).build(),
                RowTemplate.IMAGE);
            case IMAGE_ALBUMS -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.IMAGE_TITLES, page)
                    .param(LibraryQuery.TIMELINE, "albums")
                    .build(),
                RowTemplate.IMAGE_GROUP);
            case IMAGE_TIMELINE -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.IMAGE_TITLES, page)
                    .param(LibraryQuery.TIMELINE, "years")
                    .build(),
                RowTemplate.IMAGE_GROUP);
            case IMAGE_DATES -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.IMAGE_TITLES, page)
                    .param(LibraryQuery.TIMELINE, "dates")
                    .build(),
                RowTemplate.IMAGE_GROUP);
            // The video folder menu has no browsable content
            case VIDEO_FOLDER -> TranslatedQuery.noRows(RowTemplate.FOLDER);
            // Standalone tracks are addressable one by one but cannot be listed
            case TRACKS -> throw UpnpFault.noSuchObject();
        };
    }

    private TranslatedQuery metadata(ObjectPath path) {
        PageWindow single = PageWindow.SINGLE;
        return switch (path.type()) {
            // Mount roots are static menu entries
            case MOUNT_ROOT -> throw UpnpFault.noSuchObject();
            case ARTIST -> TranslatedQuery.of(
                withGenre(path, LibraryQuery.builder(LibraryCommand.ARTISTS, single))
                    .param(LibraryQuery.ARTIST_ID, path.key(PathKey.ARTIST))
                    .build(),
                RowTemplate.ARTIST);
            case ALBUM -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.ALBUMS, single)
                    .param(LibraryQuery.ALBUM_ID, path.key(PathKey.ALBUM))
                    .build(),
                RowTemplate.ALBUM);
            case GENRE -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.GENRES, single)
                    .param(LibraryQuery.GENRE_ID, path.key(PathKey.GENRE))
                    .build(),
                RowTemplate.GENRE);
            case YEAR -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.YEARS, single)
                    .param(LibraryQuery.YEAR, path.key(PathKey.YEAR))
                    .build(),
                RowTemplate.YEAR);
            case FOLDER -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.MUSICFOLDER, single)
                    .param(LibraryQuery.FOLDER_ID, path.key(PathKey.FOLDER))
                    .param(LibraryQuery.RETURN_TOP, 1)
                    .build(),
                RowTemplate.FOLDER);
            case PLAYLIST -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.PLAYLISTS, single)
                    .param(LibraryQuery.PLAYLIST_ID, path.key(PathKey.PLAYLIST))
                    .build(),
                RowTemplate.PLAYLIST);
            case TRACK -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.TITLES, single)
                    .param(LibraryQuery.TRACK_ID, path.key(PathKey.TRACK))
                    .build(),
                RowTemplate.TRACK);
            case VIDEO -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.VIDEO_TITLES, single)
                    .param(LibraryQuery.VIDEO_ID, path.key(PathKey.HASH))
                    .build(),
                RowTemplate.VIDEO);
            case IMAGE -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.IMAGE_TITLES, single)
                    .param(LibraryQuery.IMAGE_ID, path.key(PathKey.HASH))
                    .build(),
                RowTemplate.IMAGE);
            case IMAGE_ALBUM -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.IMAGE_TITLES, single)
                    .param(LibraryQuery.TIMELINE, "albums")
                    .param(LibraryQuery.GROUP, path.key(PathKey.IMAGE_ALBUM))
                    .build(),
                RowTemplate.IMAGE_GROUP);
            case TIMELINE_YEAR -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.IMAGE_TITLES, single)
                    .param(LibraryQuery.TIMELINE, "years")
                    .param(LibraryQuery.GROUP, path.key(PathKey.YEAR))
                    .build(),
                RowTemplate.IMAGE_GROUP);
            case TIMELINE_MONTH -> TranslatedQuery.of(
                timeline(single, "months", path.key(PathKey.YEAR))
                    .param(LibraryQuery.GROUP, path.key(PathKey.MONTH))
                    .build(),
                RowTemplate.IMAGE_GROUP);
            case TIMELINE_DAY -> TranslatedQuery.of(
                timeline(single, "days", path.key(PathKey.YEAR) + "-" + path.key(PathKey.MONTH))
                    .param(LibraryQuery.GROUP, path.key(PathKey.DAY))
                    .build(),
                RowTemplate.IMAGE_GROUP);
            case DATE -> TranslatedQuery.of(
                LibraryQuery.builder(LibraryCommand.IMAGE_TITLES, single)
                    .param(LibraryQuery.TIMELINE, "dates")
                    .param(LibraryQuery.GROUP, path.key(PathKey.YEAR) + "/" + path.key(PathKey.MONTH)
                        + "/" + path.key(PathKey.DAY))
                    .build(),
                RowTemplate.IMAGE_GROUP);
        };
    }

    private static LibraryQuery.Builder withGenre(ObjectPath path, LibraryQuery.Builder builder) {
        if (path.has(PathKey.GENRE)) {
            builder.param(LibraryQuery.GENRE_ID, path.key(PathKey.GENRE));
        }
        return builder;
    }

    private static LibraryQuery.Builder timeline(PageWindow page, String timeline, String search) {
        return LibraryQuery.builder(LibraryCommand.IMAGE_TITLES, page)
            .param(LibraryQuery.TIMELINE, timeline)
            .param(LibraryQuery.SEARCH, search);
    }

    private static String day(ObjectPath path) {
        return path.key(PathKey.YEAR) + "-" + path.key(PathKey.MONTH) + "-" + path.key(PathKey.DAY);
    }

    private static void checkSort(ObjectPath path, TranslatedQuery translated, String sort) {
        if (sort == null || sort.isBlank() || translated.nativeSort() == null) {
            return;
        }
        if (!sort.trim().equals(translated.nativeSort())) {
            LoggerUtil.warn("Unsupported sort '" + sort + "' for " + path + ", using "
                + translated.nativeSort() + " order");
        }
    }
}
