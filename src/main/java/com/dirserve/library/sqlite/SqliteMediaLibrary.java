/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library.sqlite;

import com.dirserve.db.DatabaseManager;
import com.dirserve.db.LibrarySchema;
import com.dirserve.library.LibraryCommand;
import com.dirserve.library.LibraryException;
import com.dirserve.library.LibraryQuery;
import com.dirserve.library.LibraryResult;
import com.dirserve.library.LibraryRows.AlbumRow;
import com.dirserve.library.LibraryRows.ArtistRow;
import com.dirserve.library.LibraryRows.FolderRow;
import com.dirserve.library.LibraryRows.GenreRow;
import com.dirserve.library.LibraryRows.ImageGroupRow;
import com.dirserve.library.LibraryRows.ImageRow;
import com.dirserve.library.LibraryRows.LibraryRow;
import com.dirserve.library.LibraryRows.PlaylistRow;
import com.dirserve.library.LibraryRows.TrackRow;
import com.dirserve.library.LibraryRows.VideoRow;
import com.dirserve.library.LibraryRows.YearRow;
import com.dirserve.library.LibrarySearch;
import com.dirserve.library.MediaLibrary;
import com.dirserve.library.PageWindow;
import com.dirserve.utils.LoggerUtil;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link MediaLibrary} backed by the SQLite library database.
 *
 * <p>Every browse command is a pair of statements: a row query with LIMIT/OFFSET
 * for the page window and a COUNT query with the same WHERE clause for the total.
 * Table names are used unaliased so search predicates produced by the criteria
 * decoder ({@code tracks.titlesearch}, {@code contributors.namesearch}, ...) apply
 * directly.
 */
public class SqliteMediaLibrary implements MediaLibrary {

    private static final Set<Character> ALL_TRACK_TAGS = Set.of(
        LibrarySearch.TAG_ARTIST, LibrarySearch.TAG_ALBUM, LibrarySearch.TAG_GENRE);

    private static final String VIDEO_COLUMNS =
        "SELECT videos.hash, videos.url, videos.title, videos.album, videos.mime_type, videos.secs,"
            + " videos.width, videos.height, videos.filesize, videos.mtime, videos.updated_time FROM videos";

    private static final String IMAGE_COLUMNS =
        "SELECT images.hash, images.url, images.title, images.album, images.mime_type, images.width,"
            + " images.height, images.filesize, images.original_time, images.mtime, images.updated_time FROM images";

    private static final String IMAGE_DAY = "strftime('%Y-%m-%d', images.original_time, 'unixepoch')";

    private final DatabaseManager databaseManager;

    public SqliteMediaLibrary(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
    }

    @FunctionalInterface
    private interface RowMapper {
        LibraryRow map(ResultSet rs) throws SQLException;
    }

    @Override
    public LibraryResult execute(LibraryQuery query) {
        LoggerUtil.debug(() -> "[SqliteMediaLibrary] Executing: " + query);

        return switch (query.command()) {
            case ARTISTS -> artists(query);
            case ALBUMS -> albums(query);
            case GENRES -> genres(query);
            case YEARS -> years(query);
            case MUSICFOLDER -> musicFolder(query);
            case TITLES -> titles(query);
            case PLAYLISTS -> playlists(query);
            case PLAYLIST_TRACKS -> playlistTracks(query);
            case VIDEO_TITLES -> videoTitles(query);
            case IMAGE_TITLES -> imageTitles(query);
        };
    }

    @Override
    public LibraryResult search(LibrarySearch search) {
        LoggerUtil.debug(() -> "[SqliteMediaLibrary] Searching " + search.table().getTableName()
            + " where " + search.predicate() + " order " + search.orderBy());

        String where = " WHERE (" + search.predicate() + ")";
        List<Object> params = search.parameters();

        return switch (search.table()) {
            case TRACKS -> {
                String from = trackFrom(search.tags());
                yield page(LibraryCommand.TITLES,
                    trackColumns(search.tags()) + from + where + orderBy(search.orderBy(), "tracks.titlesort, tracks.id"),
                    "SELECT COUNT(*)" + from + where,
                    params, search.page(), SqliteMediaLibrary::mapTrack);
            }
            case VIDEOS -> page(LibraryCommand.VIDEO_TITLES,
                VIDEO_COLUMNS + where + orderBy(search.orderBy(), "videos.titlesort, videos.hash"),
                "SELECT COUNT(*) FROM videos" + where,
                params, search.page(), SqliteMediaLibrary::mapVideo);
            case IMAGES -> page(LibraryCommand.IMAGE_TITLES,
                IMAGE_COLUMNS + where + orderBy(search.orderBy(), "images.titlesort, images.hash"),
                "SELECT COUNT(*) FROM images" + where,
                params, search.page(), SqliteMediaLibrary::mapImage);
        };
    }

    @Override
    public Map<Long, TrackRow> trackDetails(Collection<Long> trackIds) {
        if (trackIds.isEmpty()) {
            return Collections.emptyMap();
        }

        String placeholders = trackIds.stream().map(id -> "?").collect(Collectors.joining(","));
        String sql = trackColumns(ALL_TRACK_TAGS) + trackFrom(ALL_TRACK_TAGS)
            + " WHERE tracks.id IN (" + placeholders + ")";

        Map<Long, TrackRow> tracks = new LinkedHashMap<>();
        for (LibraryRow row : query(sql, new ArrayList<>(trackIds), SqliteMediaLibrary::mapTrack)) {
            TrackRow track = (TrackRow) row;
            tracks.put(track.id(), track);
        }
        return tracks;
    }

    @Override
    public long lastScanTime() {
        String sql = "SELECT value FROM scan_info WHERE name = ?";
        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, LibrarySchema.LAST_SCAN_TIME);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next() && rs.getString(1) != null) {
                    return Long.parseLong(rs.getString(1));
                }
                return 0L;
            }
        } catch (SQLException | NumberFormatException e) {
            throw new LibraryException("Failed to read last scan time", e);
        }
    }

    // ==================== Browse commands ====================

    private LibraryResult artists(LibraryQuery query) {
        List<Object> params = new ArrayList<>();
        StringBuilder where = new StringBuilder(" WHERE contributors.id IN (SELECT primary_artist FROM tracks");
        query.param(LibraryQuery.GENRE_ID).ifPresent(genre -> {
            where.append(" WHERE genre = ?");
            params.add(parseLong(query, genre));
        });
        where.append(')');
        query.param(LibraryQuery.ARTIST_ID).ifPresent(artist -> {
            where.append(" AND contributors.id = ?");
            params.add(parseLong(query, artist));
        });

        return page(LibraryCommand.ARTISTS,
            "SELECT contributors.id, contributors.name FROM contributors" + where
                + " ORDER BY contributors.namesort, contributors.id",
            "SELECT COUNT(*) FROM contributors" + where,
            params, query.page(),
            rs -> new ArtistRow(rs.getLong(1), rs.getString(2)));
    }

    private LibraryResult albums(LibraryQuery query) {
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        List<String> trackConditions = new ArrayList<>();
        query.param(LibraryQuery.ARTIST_ID).ifPresent(artist -> {
            trackConditions.add("primary_artist = ?");
            params.add(parseLong(query, artist));
        });
        query.param(LibraryQuery.GENRE_ID).ifPresent(genre -> {
            trackConditions.add("genre = ?");
            params.add(parseLong(query, genre));
        });
        if (!trackConditions.isEmpty()) {
            conditions.add("albums.id IN (SELECT album FROM tracks WHERE "
                + String.join(" AND ", trackConditions) + ")");
        }
        query.param(LibraryQuery.YEAR).ifPresent(year -> {
            conditions.add("albums.year = ?");
            params.add(parseLong(query, year));
        });
        query.param(LibraryQuery.ALBUM_ID).ifPresent(album -> {
            conditions.add("albums.id = ?");
            params.add(parseLong(query, album));
        });

        String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
        String order = LibraryQuery.SORT_NEW.equals(query.params().get(LibraryQuery.SORT))
            ? " ORDER BY albums.added_time DESC, albums.id DESC"
            : " ORDER BY albums.titlesort, albums.id";

        return page(LibraryCommand.ALBUMS,
            "SELECT albums.id, albums.title, contributors.name, albums.year, albums.artwork FROM albums"
                + " LEFT JOIN contributors ON contributors.id = albums.contributor" + where + order,
            "SELECT COUNT(*) FROM albums" + where,
            params, query.page(),
            rs -> new AlbumRow(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getInt(4), nullableLong(rs, 5)));
    }

    private LibraryResult genres(LibraryQuery query) {
        List<Object> params = new ArrayList<>();
        StringBuilder where = new StringBuilder(" WHERE genres.id IN (SELECT genre FROM tracks)");
        query.param(LibraryQuery.GENRE_ID).ifPresent(genre -> {
            where.append(" AND genres.id = ?");
            params.add(parseLong(query, genre));
        });

        return page(LibraryCommand.GENRES,
            "SELECT genres.id, genres.name FROM genres" + where + " ORDER BY genres.namesort, genres.id",
            "SELECT COUNT(*) FROM genres" + where,
            params, query.page(),
            rs -> new GenreRow(rs.getLong(1), rs.getString(2)));
    }

    private LibraryResult years(LibraryQuery query) {
        List<Object> params = new ArrayList<>();
        String where = "";
        if (query.hasParam(LibraryQuery.YEAR)) {
            where = " WHERE albums.year = ?";
            params.add(parseLong(query, query.params().get(LibraryQuery.YEAR)));
        }

        return page(LibraryCommand.YEARS,
            "SELECT DISTINCT albums.year FROM albums" + where + " ORDER BY albums.year",
            "SELECT COUNT(DISTINCT albums.year) FROM albums" + where,
            params, query.page(),
            rs -> new YearRow(rs.getInt(1)));
    }

    private LibraryResult musicFolder(LibraryQuery query) {
        List<Object> params = new ArrayList<>();
        String where;
        if (query.hasParam(LibraryQuery.FOLDER_ID)) {
            params.add(parseLong(query, query.params().get(LibraryQuery.FOLDER_ID)));
            where = query.hasParam(LibraryQuery.RETURN_TOP)
                ? " WHERE folder_entries.id = ?"
                : " WHERE folder_entries.parent_id = ?";
        } else {
            where = " WHERE folder_entries.parent_id IS NULL";
        }

        return page(LibraryCommand.MUSICFOLDER,
            "SELECT folder_entries.id, folder_entries.filename, folder_entries.type, folder_entries.track"
                + " FROM folder_entries" + where + " ORDER BY folder_entries.filename COLLATE NOCASE, folder_entries.id",
            "SELECT COUNT(*) FROM folder_entries" + where,
            params, query.page(),
            rs -> {
                String type = rs.getString(3);
                Long track = nullableLong(rs, 4);
                long id = FolderRow.TYPE_TRACK.equals(type) && track != null ? track : rs.getLong(1);
                return new FolderRow(id, rs.getString(2), type);
            });
    }

    private LibraryResult titles(LibraryQuery query) {
        List<Object> params = new ArrayList<>();
        String where = "";
        String order = " ORDER BY tracks.titlesort, tracks.id";

        if (query.hasParam(LibraryQuery.TRACK_ID)) {
            where = " WHERE tracks.id = ?";
            params.add(parseLong(query, query.params().get(LibraryQuery.TRACK_ID)));
        } else if (query.hasParam(LibraryQuery.ALBUM_ID)) {
            where = " WHERE tracks.album = ?";
            params.add(parseLong(query, query.params().get(LibraryQuery.ALBUM_ID)));
        }
        if (LibraryQuery.SORT_TRACKNUM.equals(query.params().get(LibraryQuery.SORT))) {
            order = " ORDER BY tracks.tracknum, tracks.titlesort, tracks.id";
        }

        return page(LibraryCommand.TITLES,
            trackColumns(ALL_TRACK_TAGS) + trackFrom(ALL_TRACK_TAGS) + where + order,
            "SELECT COUNT(*) FROM tracks" + where,
            params, query.page(), SqliteMediaLibrary::mapTrack);
    }

    private LibraryResult playlists(LibraryQuery query) {
        List<Object> params = new ArrayList<>();
        String where = "";
        if (query.hasParam(LibraryQuery.PLAYLIST_ID)) {
            where = " WHERE playlists.id = ?";
            params.add(parseLong(query, query.params().get(LibraryQuery.PLAYLIST_ID)));
        }

        return page(LibraryCommand.PLAYLISTS,
            "SELECT playlists.id, playlists.title FROM playlists" + where + " ORDER BY playlists.titlesort, playlists.id",
            "SELECT COUNT(*) FROM playlists" + where,
            params, query.page(),
            rs -> new PlaylistRow(rs.getLong(1), rs.getString(2)));
    }

    private LibraryResult playlistTracks(LibraryQuery query) {
        String playlist = query.param(LibraryQuery.PLAYLIST_ID)
            .orElseThrow(() -> new LibraryException.UnsupportedQueryException(query));
        List<Object> params = List.of(parseLong(query, playlist));

        String join = " JOIN playlist_track ON playlist_track.track = tracks.id WHERE playlist_track.playlist = ?";
        return page(LibraryCommand.PLAYLIST_TRACKS,
            trackColumns(ALL_TRACK_TAGS) + trackFrom(ALL_TRACK_TAGS) + join + " ORDER BY playlist_track.position",
            "SELECT COUNT(*) FROM tracks" + join,
            params, query.page(), SqliteMediaLibrary::mapTrack);
    }

    private LibraryResult videoTitles(LibraryQuery query) {
        List<Object> params = new ArrayList<>();
        String where = "";
        if (query.hasParam(LibraryQuery.VIDEO_ID)) {
            where = " WHERE videos.hash = ?";
            params.add(query.params().get(LibraryQuery.VIDEO_ID));
        }

        return page(LibraryCommand.VIDEO_TITLES,
            VIDEO_COLUMNS + where + " ORDER BY videos.titlesort, videos.hash",
            "SELECT COUNT(*) FROM videos" + where,
            params, query.page(), SqliteMediaLibrary::mapVideo);
    }

    private LibraryResult imageTitles(LibraryQuery query) {
        if (query.hasParam(LibraryQuery.IMAGE_ID)) {
            return imagePage(" WHERE images.hash = ?", List.of(query.params().get(LibraryQuery.IMAGE_ID)),
                " ORDER BY images.hash", query.page());
        }

        String timeline = query.params().get(LibraryQuery.TIMELINE);
        if (timeline == null) {
            if (query.hasParam(LibraryQuery.ALBUM)) {
                return imagePage(" WHERE images.album = ?", List.of(query.params().get(LibraryQuery.ALBUM)),
                    " ORDER BY images.titlesort, images.hash", query.page());
            }
            return imagePage("", List.of(), " ORDER BY images.titlesort, images.hash", query.page());
        }

        if ("day".equals(timeline)) {
            String day = query.param(LibraryQuery.SEARCH)
                .orElseThrow(() -> new LibraryException.UnsupportedQueryException(query));
            return imagePage(" WHERE " + IMAGE_DAY + " = ?", List.of(day),
                " ORDER BY images.original_time, images.titlesort, images.hash", query.page());
        }

        return imageGroups(query, ImageGrouping.forTimeline(timeline)
            .orElseThrow(() -> new LibraryException.UnsupportedQueryException(query)));
    }

    private LibraryResult imagePage(String where, List<Object> params, String order, PageWindow page) {
        return page(LibraryCommand.IMAGE_TITLES,
            IMAGE_COLUMNS + where + order,
            "SELECT COUNT(*) FROM images" + where,
            params, page, SqliteMediaLibrary::mapImage);
    }

    private LibraryResult imageGroups(LibraryQuery query, ImageGrouping grouping) {
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (grouping.scopeExpression() != null) {
            String scope = query.param(LibraryQuery.SEARCH)
                .orElseThrow(() -> new LibraryException.UnsupportedQueryException(query));
            conditions.add(grouping.scopeExpression() + " = ?");
            params.add(scope);
        }
        conditions.add(grouping.keyExpression() + " IS NOT NULL");
        query.param(LibraryQuery.GROUP).ifPresent(group -> {
            conditions.add(grouping.keyExpression() + " = ?");
            params.add(group);
        });

        String where = " WHERE " + String.join(" AND ", conditions);
        String scope = query.params().get(LibraryQuery.SEARCH);

        return page(LibraryCommand.IMAGE_TITLES,
            "SELECT DISTINCT " + grouping.keyExpression() + " AS group_key FROM images" + where + " ORDER BY group_key",
            "SELECT COUNT(DISTINCT " + grouping.keyExpression() + ") FROM images" + where,
            params, query.page(),
            rs -> {
                String key = rs.getString(1);
                String id = grouping == ImageGrouping.ALBUMS
                    ? URLEncoder.encode(key, StandardCharsets.UTF_8)
                    : key;
                return new ImageGroupRow(id, grouping.title(scope, key));
            });
    }

    // ==================== Track select ====================

    private static String trackColumns(Set<Character> tags) {
        boolean album = tags.contains(LibrarySearch.TAG_ALBUM);
        return "SELECT tracks.id, tracks.url, tracks.title, tracks.tracknum, tracks.secs, tracks.year,"
            + " tracks.content_type, tracks.bitrate, tracks.samplerate, tracks.filesize, tracks.album,"
            + (album ? " albums.title" : " NULL") + " AS album_title,"
            + (album ? " albums.artwork" : " NULL") + " AS artwork,"
            + " tracks.primary_artist,"
            + (tags.contains(LibrarySearch.TAG_ARTIST) ? " contributors.name" : " NULL") + " AS artist_name,"
            + (tags.contains(LibrarySearch.TAG_GENRE) ? " genres.name" : " NULL") + " AS genre_name,"
            + " tracks.timestamp, tracks.added_time, tracks.updated_time";
    }

    private static String trackFrom(Set<Character> tags) {
        StringBuilder from = new StringBuilder(" FROM tracks");
        if (tags.contains(LibrarySearch.TAG_ALBUM)) {
            from.append(" LEFT JOIN albums ON albums.id = tracks.album");
        }
        if (tags.contains(LibrarySearch.TAG_ARTIST)) {
            from.append(" LEFT JOIN contributors ON contributors.id = tracks.primary_artist");
        }
        if (tags.contains(LibrarySearch.TAG_GENRE)) {
            from.append(" LEFT JOIN genres ON genres.id = tracks.genre");
        }
        return from.toString();
    }

    private static TrackRow mapTrack(ResultSet rs) throws SQLException {
        return new TrackRow(
            rs.getLong("id"),
            rs.getString("url"),
            rs.getString("title"),
            nullableInt(rs, "tracknum"),
            nullableDouble(rs, "secs"),
            rs.getInt("year"),
            rs.getString("content_type"),
            nullableInt(rs, "bitrate"),
            nullableInt(rs, "samplerate"),
            nullableLong(rs, "filesize"),
            nullableLong(rs, "album"),
            rs.getString("album_title"),
            nullableLong(rs, "artwork"),
            nullableLong(rs, "primary_artist"),
            rs.getString("artist_name"),
            rs.getString("genre_name"),
            rs.getLong("timestamp"),
            rs.getLong("added_time"),
            rs.getLong("updated_time")
        );
    }

    private static VideoRow mapVideo(ResultSet rs) throws SQLException {
        return new VideoRow(
            rs.getString("hash"),
            rs.getString("url"),
            rs.getString("title"),
            rs.getString("album"),
            rs.getString("mime_type"),
            nullableDouble(rs, "secs"),
            nullableInt(rs, "width"),
            nullableInt(rs, "height"),
            nullableLong(rs, "filesize"),
            rs.getLong("mtime"),
            rs.getLong("updated_time")
        );
    }

    private static ImageRow mapImage(ResultSet rs) throws SQLException {
        return new ImageRow(
            rs.getString("hash"),
            rs.getString("url"),
            rs.getString("title"),
            rs.getString("album"),
            rs.getString("mime_type"),
            nullableInt(rs, "width"),
            nullableInt(rs, "height"),
            nullableLong(rs, "filesize"),
            rs.getLong("original_time"),
            rs.getLong("mtime"),
            rs.getLong("updated_time")
        );
    }

    // ==================== JDBC helpers ====================

    private LibraryResult page(LibraryCommand command, String selectSql, String countSql,
                               List<Object> params, PageWindow page, RowMapper mapper) {
        List<Object> pagedParams = new ArrayList<>(params);
        pagedParams.add(page.sqlLimit());
        pagedParams.add(page.start());

        List<LibraryRow> rows = query(selectSql + " LIMIT ? OFFSET ?", pagedParams, mapper);
        int count = count(countSql, params);
        return new LibraryResult(command, rows, count);
    }

    private List<LibraryRow> query(String sql, List<Object> params, RowMapper mapper) {
        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            List<LibraryRow> rows = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            LoggerUtil.error("[SqliteMediaLibrary] Query failed: " + sql, e);
            throw new LibraryException("Library query failed: " + e.getMessage(), e);
        }
    }

    private int count(String sql, List<Object> params) {
        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            LoggerUtil.error("[SqliteMediaLibrary] Count failed: " + sql, e);
            throw new LibraryException("Library count failed: " + e.getMessage(), e);
        }
    }

    private static void bind(PreparedStatement stmt, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            stmt.setObject(i + 1, params.get(i));
        }
    }

    private static String orderBy(String requested, String fallback) {
        return " ORDER BY " + (requested == null || requested.isBlank() ? fallback : requested);
    }

    private static long parseLong(LibraryQuery query, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new LibraryException("Invalid numeric parameter '" + value + "' in " + query, e);
        }
    }

    private static Long nullableLong(ResultSet rs, int column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
