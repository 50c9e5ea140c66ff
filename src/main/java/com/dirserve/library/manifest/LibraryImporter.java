/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library.manifest;

import com.dirserve.db.DatabaseManager;
import com.dirserve.db.LibrarySchema;
import com.dirserve.library.LibraryException.ManifestException;
import com.dirserve.library.LibraryRows.FolderRow;
import com.dirserve.library.ScanListener;
import com.dirserve.utils.JacksonConfig;
import com.dirserve.utils.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * Performs a library rescan: reads a {@link LibraryManifest} and replaces the
 * library tables with its content in one transaction, then notifies
 * {@link ScanListener}s with the scan completion time.
 *
 * <p>Rescans are serialized; a second caller waits for the running import.
 */
public class LibraryImporter {

    private static final Set<String> FOLDER_TYPES = Set.of(
        FolderRow.TYPE_FOLDER, FolderRow.TYPE_PLAYLIST, FolderRow.TYPE_TRACK, FolderRow.TYPE_UNKNOWN);

    /** Videos and images are addressed by this hash in object IDs and media URLs. */
    private static final Pattern MEDIA_HASH = Pattern.compile("[0-9a-f]{8}");
    private static final List<String> SORT_ARTICLES = List.of("THE ", "A ", "AN ");

    private final DatabaseManager databaseManager;
    private final ObjectMapper objectMapper;
    private final LongSupplier clock;
    private final List<ScanListener> listeners = new CopyOnWriteArrayList<>();

    public LibraryImporter(DatabaseManager databaseManager) {
        this(databaseManager, () -> System.currentTimeMillis() / 1000);
    }

    /**
     * @param clock source of the scan completion time in epoch seconds
     */
    public LibraryImporter(DatabaseManager databaseManager, LongSupplier clock) {
        this.databaseManager = databaseManager;
        this.objectMapper = JacksonConfig.manifestMapper();
        this.clock = clock;
    }

    public void addScanListener(ScanListener listener) {
        listeners.add(listener);
    }

    /**
     * Summary of a completed import.
     */
    public record ImportSummary(
        int artists,
        int albums,
        int genres,
        int tracks,
        int folders,
        int playlists,
        int videos,
        int images,
        long scanTime
    ) {}

    public ImportSummary importFile(Path manifestPath) {
        if (!Files.isRegularFile(manifestPath)) {
            throw new ManifestException("manifest not found: " + manifestPath);
        }
        try (InputStream in = Files.newInputStream(manifestPath)) {
            LoggerUtil.info("Importing library manifest: " + manifestPath);
            return importManifest(objectMapper.readValue(in, LibraryManifest.class));
        } catch (IOException e) {
            throw new ManifestException("cannot read " + manifestPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads a manifest from the classpath, used for bundled sample libraries.
     */
    public ImportSummary importResource(String resource) {
        try (InputStream in = LibraryImporter.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ManifestException("manifest resource not found: " + resource);
            }
            LoggerUtil.info("Importing library manifest resource: " + resource);
            return importManifest(objectMapper.readValue(in, LibraryManifest.class));
        } catch (IOException e) {
            throw new ManifestException("cannot read " + resource + ": " + e.getMessage(), e);
        }
    }

    public synchronized ImportSummary importManifest(LibraryManifest manifest) {
        validate(manifest);

        long scanTime = clock.getAsLong();
        try (Connection conn = databaseManager.getConnection()) {
            conn.setAutoCommit(false);
            try {
                clearLibrary(conn);
                insertNamed(conn, "contributors", manifest.artists());
                insertNamed(conn, "genres", manifest.genres());
                insertAlbums(conn, manifest.albums());
                insertTracks(conn, manifest.tracks());
                insertFolders(conn, manifest.folders());
                insertPlaylists(conn, manifest.playlists());
                insertVideos(conn, manifest.videos());
                insertImages(conn, manifest.images());
                writeScanTime(conn, scanTime);

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            LoggerUtil.error("Library import failed", e);
            throw new ManifestException("database write failed: " + e.getMessage(), e);
        }

        ImportSummary summary = new ImportSummary(
            manifest.artists().size(), manifest.albums().size(), manifest.genres().size(),
            manifest.tracks().size(), manifest.folders().size(), manifest.playlists().size(),
            manifest.videos().size(), manifest.images().size(), scanTime);
        LoggerUtil.info("Library import completed: " + summary);

        for (ScanListener listener : listeners) {
            try {
                listener.rescanCompleted(scanTime);
            } catch (RuntimeException e) {
                LoggerUtil.error("Scan listener failed: " + e.getMessage(), e);
            }
        }
        return summary;
    }

    /**
     * Sort key: upper-cased with a leading English article moved out of the way.
     */
    static String sortKey(String value) {
        if (value == null) {
            return null;
        }
        String upper = value.trim().toUpperCase(Locale.ROOT);
        for (String article : SORT_ARTICLES) {
            if (upper.startsWith(article) && upper.length() > article.length()) {
                return upper.substring(article.length());
            }
        }
        return upper;
    }

    /** Search columns hold upper-cased text so LIKE patterns can be upper-cased too. */
    static String searchKey(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }

    private void validate(LibraryManifest manifest) {
        for (LibraryManifest.Folder folder : manifest.folders()) {
            if (folder.type() == null || !FOLDER_TYPES.contains(folder.type())) {
                throw new ManifestException("folder " + folder.id() + " has invalid type: " + folder.type());
            }
            if (FolderRow.TYPE_TRACK.equals(folder.type()) && folder.trackId() == null) {
                throw new ManifestException("track folder entry " + folder.id() + " has no trackId");
            }
        }
        for (LibraryManifest.Track track : manifest.tracks()) {
            if (track.url() == null || track.title() == null) {
                throw new ManifestException("track " + track.id() + " needs url and title");
            }
        }
        for (LibraryManifest.Video video : manifest.videos()) {
            if (video.hash() == null || video.url() == null) {
                throw new ManifestException("video entries need hash and url");
            }
            if (!MEDIA_HASH.matcher(video.hash()).matches()) {
                throw new ManifestException("video hash must be 8 lowercase hex digits: " + video.hash());
            }
        }
        for (LibraryManifest.Image image : manifest.images()) {
            if (image.hash() == null || image.url() == null) {
                throw new ManifestException("image entries need hash and url");
            }
            if (!MEDIA_HASH.matcher(image.hash()).matches()) {
                throw new ManifestException("image hash must be 8 lowercase hex digits: " + image.hash());
            }
        }
    }

    private void clearLibrary(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            // Children before parents for the foreign keys
            for (String table : List.of("playlist_track", "playlists", "folder_entries", "tracks",
                                        "albums", "genres", "contributors", "videos", "images")) {
                stmt.executeUpdate("DELETE FROM " + table);
            }
        }
    }

    private void insertNamed(Connection conn, String table, List<LibraryManifest.Named> entries) throws SQLException {
        String sql = "INSERT INTO " + table + " (id, name, namesort, namesearch) VALUES (?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (LibraryManifest.Named entry : entries) {
                stmt.setLong(1, entry.id());
                stmt.setString(2, entry.name());
                stmt.setString(3, sortKey(entry.name()));
                stmt.setString(4, searchKey(entry.name()));
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertAlbums(Connection conn, List<LibraryManifest.Album> albums) throws SQLException {
        String sql = """
            INSERT INTO albums (id, title, titlesort, titlesearch, contributor, year, artwork, added_time)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (LibraryManifest.Album album : albums) {
                stmt.setLong(1, album.id());
                stmt.setString(2, album.title());
                stmt.setString(3, sortKey(album.title()));
                stmt.setString(4, searchKey(album.title()));
                setLong(stmt, 5, album.artistId());
                stmt.setInt(6, album.year());
                setLong(stmt, 7, album.artworkTrackId());
                stmt.setLong(8, album.addedTime());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertTracks(Connection conn, List<LibraryManifest.Track> tracks) throws SQLException {
        String sql = """
            INSERT INTO tracks (id, url, title, titlesort, titlesearch, album, primary_artist, genre,
                                tracknum, year, secs, content_type, bitrate, samplerate, filesize,
                                timestamp, added_time, updated_time)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (LibraryManifest.Track track : tracks) {
                stmt.setLong(1, track.id());
                stmt.setString(2, track.url());
                stmt.setString(3, track.title());
                stmt.setString(4, sortKey(track.title()));
                stmt.setString(5, searchKey(track.title()));
                setLong(stmt, 6, track.albumId());
                setLong(stmt, 7, track.artistId());
                setLong(stmt, 8, track.genreId());
                setInt(stmt, 9, track.tracknum());
                stmt.setInt(10, track.year());
                setDouble(stmt, 11, track.secs());
                stmt.setString(12, track.contentType());
                setInt(stmt, 13, track.bitrate());
                setInt(stmt, 14, track.samplerate());
                setLong(stmt, 15, track.filesize());
                stmt.setLong(16, track.timestamp());
                stmt.setLong(17, track.addedTime());
                stmt.setLong(18, track.updatedTime());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertFolders(Connection conn, List<LibraryManifest.Folder> folders) throws SQLException {
        String sql = "INSERT INTO folder_entries (id, parent_id, filename, type, track) VALUES (?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (LibraryManifest.Folder folder : folders) {
                stmt.setLong(1, folder.id());
                setLong(stmt, 2, folder.parentId());
                stmt.setString(3, folder.filename());
                stmt.setString(4, folder.type());
                setLong(stmt, 5, folder.trackId());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertPlaylists(Connection conn, List<LibraryManifest.Playlist> playlists) throws SQLException {
        String playlistSql = "INSERT INTO playlists (id, title, titlesort, titlesearch) VALUES (?, ?, ?, ?)";
        String entrySql = "INSERT INTO playlist_track (playlist, position, track) VALUES (?, ?, ?)";
        try (PreparedStatement playlistStmt = conn.prepareStatement(playlistSql);
             PreparedStatement entryStmt = conn.prepareStatement(entrySql)) {
            for (LibraryManifest.Playlist playlist : playlists) {
                playlistStmt.setLong(1, playlist.id());
                playlistStmt.setString(2, playlist.title());
                playlistStmt.setString(3, sortKey(playlist.title()));
                playlistStmt.setString(4, searchKey(playlist.title()));
                playlistStmt.addBatch();

                int position = 0;
                for (Long trackId : playlist.trackIds()) {
                    entryStmt.setLong(1, playlist.id());
                    entryStmt.setInt(2, position++);
                    entryStmt.setLong(3, trackId);
                    entryStmt.addBatch();
                }
            }
            playlistStmt.executeBatch();
            entryStmt.executeBatch();
        }
    }

    private void insertVideos(Connection conn, List<LibraryManifest.Video> videos) throws SQLException {
        String sql = """
            INSERT INTO videos (hash, url, title, titlesort, titlesearch, album, mime_type, secs,
                                width, height, filesize, mtime, added_time, updated_time)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (LibraryManifest.Video video : videos) {
                String title = video.title() != null ? video.title() : video.hash();
                stmt.setString(1, video.hash());
                stmt.setString(2, video.url());
                stmt.setString(3, title);
                stmt.setString(4, sortKey(title));
                stmt.setString(5, searchKey(title));
                stmt.setString(6, video.album());
                stmt.setString(7, video.mimeType());
                setDouble(stmt, 8, video.secs());
                setInt(stmt, 9, video.width());
                setInt(stmt, 10, video.height());
                setLong(stmt, 11, video.filesize());
                stmt.setLong(12, video.mtime());
                stmt.setLong(13, video.addedTime());
                stmt.setLong(14, video.updatedTime());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertImages(Connection conn, List<LibraryManifest.Image> images) throws SQLException {
        String sql = """
            INSERT INTO images (hash, url, title, titlesort, titlesearch, album, mime_type, width, height,
                                filesize, original_time, mtime, added_time, updated_time)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (LibraryManifest.Image image : images) {
                String title = image.title() != null ? image.title() : image.hash();
                stmt.setString(1, image.hash());
                stmt.setString(2, image.url());
                stmt.setString(3, title);
                stmt.setString(4, sortKey(title));
                stmt.setString(5, searchKey(title));
                stmt.setString(6, image.album());
                stmt.setString(7, image.mimeType());
                setInt(stmt, 8, image.width());
                setInt(stmt, 9, image.height());
                setLong(stmt, 10, image.filesize());
                stmt.setLong(11, image.originalTime());
                stmt.setLong(12, image.mtime());
                stmt.setLong(13, image.addedTime());
                stmt.setLong(14, image.updatedTime());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void writeScanTime(Connection conn, long scanTime) throws SQLException {
        String sql = "INSERT OR REPLACE INTO scan_info (name, value) VALUES (?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, LibrarySchema.LAST_SCAN_TIME);
            stmt.setString(2, String.valueOf(scanTime));
            stmt.executeUpdate();
        }
    }

    private static void setLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, value);
        }
    }

    private static void setInt(PreparedStatement stmt, int index, Integer value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setInt(index, value);
        }
    }

    private static void setDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.REAL);
        } else {
            stmt.setDouble(index, value);
        }
    }
}
