/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.db;

import com.dirserve.utils.LoggerUtil;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the SQLite schema for the media library.
 *
 * Column names follow the conventions the search translator relies on:
 * every searchable name has an upper-cased {@code *search} column and a
 * {@code *sort} column, and timestamps are epoch seconds.
 * Safe to call multiple times - only creates tables that don't exist.
 */
public class LibrarySchema {

    /** scan_info key holding the epoch-second time of the last completed import. */
    public static final String LAST_SCAN_TIME = "last_scan_time";

    private LibrarySchema() {}

    public static void initializeSchema(DatabaseManager databaseManager) throws SQLException {
        LoggerUtil.info("Initializing library schema...");

        try (Connection conn = databaseManager.getConnection();
             Statement stmt = conn.createStatement()) {

            createContributorsTable(stmt);
            createGenresTable(stmt);
            createAlbumsTable(stmt);
            createTracksTable(stmt);
            createFoldersTable(stmt);
            createPlaylistTables(stmt);
            createVideosTable(stmt);
            createImagesTable(stmt);
            createScanInfoTable(stmt);
            createIndexes(stmt);

            LoggerUtil.info("Library schema initialization completed");
        }
    }

    private static void createContributorsTable(Statement stmt) throws SQLException {
        stmt.execute("""
            CREATE TABLE IF NOT EXISTS contributors (
                id INTEGER PRIMARY KEY,
                name TEXT NOT NULL,
                namesort TEXT,
                namesearch TEXT
            )
        """);
    }

    private static void createGenresTable(Statement stmt) throws SQLException {
        stmt.execute("""
            CREATE TABLE IF NOT EXISTS genres (
                id INTEGER PRIMARY KEY,
                name TEXT NOT NULL,
                namesort TEXT,
                namesearch TEXT
            )
        """);
    }

    private static void createAlbumsTable(Statement stmt) throws SQLException {
        stmt.execute("""
            CREATE TABLE IF NOT EXISTS albums (
                id INTEGER PRIMARY KEY,
                title TEXT NOT NULL,
                titlesort TEXT,
                titlesearch TEXT,
                contributor INTEGER REFERENCES contributors(id),
                year INTEGER DEFAULT 0,
                artwork INTEGER,
                added_time INTEGER DEFAULT 0
            )
        """);
    }

    private static void createTracksTable(Statement stmt) throws SQLException {
        stmt.execute("""
            CREATE TABLE IF NOT EXISTS tracks (
                id INTEGER PRIMARY KEY,
                url TEXT NOT NULL,
                title TEXT NOT NULL,
                titlesort TEXT,
                titlesearch TEXT,
                album INTEGER REFERENCES albums(id),
                primary_artist INTEGER REFERENCES contributors(id),
                genre INTEGER REFERENCES genres(id),
                tracknum INTEGER,
                year INTEGER DEFAULT 0,
                secs REAL,
                content_type TEXT,
                bitrate INTEGER,
                samplerate INTEGER,
                filesize INTEGER,
                timestamp INTEGER DEFAULT 0,
                added_time INTEGER DEFAULT 0,
                updated_time INTEGER DEFAULT 0
            )
        """);
    }

    private static void createFoldersTable(Statement stmt) throws SQLException {
        // Music folder tree. type is one of folder, playlist, track, unknown;
        // track entries point at the tracks table.
        stmt.execute("""
            CREATE TABLE IF NOT EXISTS folder_entries (
                id INTEGER PRIMARY KEY,
                parent_id INTEGER,
                filename TEXT NOT NULL,
                type TEXT NOT NULL,
                track INTEGER REFERENCES tracks(id)
            )
        """);
    }

    private static void createPlaylistTables(Statement stmt) throws SQLException {
        stmt.execute("""
            CREATE TABLE IF NOT EXISTS playlists (
                id INTEGER PRIMARY KEY,
                title TEXT NOT NULL,
                titlesort TEXT,
                titlesearch TEXT
            )
        """);

        stmt.execute("""
            CREATE TABLE IF NOT EXISTS playlist_track (
                playlist INTEGER NOT NULL REFERENCES playlists(id),
                position INTEGER NOT NULL,
                track INTEGER NOT NULL REFERENCES tracks(id),
                PRIMARY KEY (playlist, position)
            )
        """);
    }

    private static void createVideosTable(Statement stmt) throws SQLException {
        stmt.execute("""
            CREATE TABLE IF NOT EXISTS videos (
                hash TEXT PRIMARY KEY,
                url TEXT NOT NULL,
                title TEXT NOT NULL,
                titlesort TEXT,
                titlesearch TEXT,
                album TEXT,
                mime_type TEXT,
                secs REAL,
                width INTEGER,
                height INTEGER,
                filesize INTEGER,
                mtime INTEGER DEFAULT 0,
                added_time INTEGER DEFAULT 0,
                updated_time INTEGER DEFAULT 0
            )
        """);
    }

    private static void createImagesTable(Statement stmt) throws SQLException {
        stmt.execute("""
            CREATE TABLE IF NOT EXISTS images (
                hash TEXT PRIMARY KEY,
                url TEXT NOT NULL,
                title TEXT NOT NULL,
                titlesort TEXT,
                titlesearch TEXT,
                album TEXT,
                mime_type TEXT,
                width INTEGER,
                height INTEGER,
                filesize INTEGER,
                original_time INTEGER DEFAULT 0,
                mtime INTEGER DEFAULT 0,
                added_time INTEGER DEFAULT 0,
                updated_time INTEGER DEFAULT 0
            )
        """);
    }

    private static void createScanInfoTable(Statement stmt) throws SQLException {
        stmt.execute("""
            CREATE TABLE IF NOT EXISTS scan_info (
                name TEXT PRIMARY KEY,
                value TEXT
            )
        """);
    }

    private static void createIndexes(Statement stmt) throws SQLException {
        stmt.execute("CREATE INDEX IF NOT EXISTS idx_tracks_album ON tracks(album)");
        stmt.execute("CREATE INDEX IF NOT EXISTS idx_tracks_artist ON tracks(primary_artist)");
        stmt.execute("CREATE INDEX IF NOT EXISTS idx_tracks_genre ON tracks(genre)");
        stmt.execute("CREATE INDEX IF NOT EXISTS idx_albums_contributor ON albums(contributor)");
        stmt.execute("CREATE INDEX IF NOT EXISTS idx_albums_year ON albums(year)");
        stmt.execute("CREATE INDEX IF NOT EXISTS idx_folder_parent ON folder_entries(parent_id)");
        stmt.execute("CREATE INDEX IF NOT EXISTS idx_images_original_time ON images(original_time)");
        LoggerUtil.debug("Created library indexes");
    }
}
