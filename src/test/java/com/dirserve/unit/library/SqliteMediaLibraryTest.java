/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.unit.library;

import com.dirserve.db.DatabaseManager;
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
import com.dirserve.library.LibraryRows.TrackRow;
import com.dirserve.library.LibraryRows.VideoRow;
import com.dirserve.library.LibraryRows.YearRow;
import com.dirserve.library.LibrarySearch;
import com.dirserve.library.PageWindow;
import com.dirserve.library.SearchTable;
import com.dirserve.library.sqlite.SqliteMediaLibrary;
import com.dirserve.test.TestConfig;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs every library command against the bundled test library.
 */
@DisplayName("SqliteMediaLibrary")
class SqliteMediaLibraryTest {

    private static final long SCAN_TIME = 1_700_000_000L;
    private static final PageWindow ALL = PageWindow.of(0, 0);

    private static Path tempDbPath;
    private static DatabaseManager databaseManager;
    private static SqliteMediaLibrary library;

    @BeforeAll
    static void setUp() throws IOException, SQLException {
        tempDbPath = Files.createTempFile("dirserve_library_test", ".db");
        databaseManager = TestConfig.openTestLibrary(tempDbPath, () -> SCAN_TIME);
        library = new SqliteMediaLibrary(databaseManager);
    }

    @AfterAll
    static void tearDown() throws IOException {
        if (databaseManager != null) {
            databaseManager.close();
        }
        if (tempDbPath != null) {
            TestConfig.deleteDatabase(tempDbPath);
        }
    }

    private static LibraryResult run(LibraryCommand command, PageWindow page, String... params) {
        LibraryQuery.Builder builder = LibraryQuery.builder(command, page);
        for (int i = 0; i < params.length; i += 2) {
            builder.param(params[i], params[i + 1]);
        }
        return library.execute(builder.build());
    }

    @SuppressWarnings("unchecked")
    private static <R extends LibraryRow, T> List<T> map(LibraryResult result, Function<R, T> field) {
        return result.rows().stream().map(row -> field.apply((R) row)).toList();
    }

    @Nested
    @DisplayName("Music")
    class MusicTests {

        @Test
        @DisplayName("should list artists by sort name ignoring articles")
        void shouldListArtists() {
            LibraryResult result = run(LibraryCommand.ARTISTS, ALL);

            assertEquals(3, result.count());
            assertEquals(List.of("The Beatles", "Miles Davis", "Radiohead"), map(result, ArtistRow::artist));
        }

        @Test
        @DisplayName("should restrict artists to a genre")
        void shouldListArtistsInGenre() {
            LibraryResult result = run(LibraryCommand.ARTISTS, ALL, LibraryQuery.GENRE_ID, "11");

            assertEquals(List.of("Miles Davis"), map(result, ArtistRow::artist));
        }

        @Test
        @DisplayName("should list albums by title or by newest first")
        void shouldListAlbums() {
            assertEquals(List.of("Abbey Road", "Kind of Blue", "OK Computer"),
                map(run(LibraryCommand.ALBUMS, ALL, LibraryQuery.SORT, LibraryQuery.SORT_ALBUM), AlbumRow::album));
            assertEquals(List.of("OK Computer", "Kind of Blue", "Abbey Road"),
                map(run(LibraryCommand.ALBUMS, ALL, LibraryQuery.SORT, LibraryQuery.SORT_NEW), AlbumRow::album));
        }

        @Test
        @DisplayName("should carry album artist and artwork")
        void shouldDescribeAlbum() {
            LibraryResult result = run(LibraryCommand.ALBUMS, PageWindow.SINGLE, LibraryQuery.ARTIST_ID, "1");

            assertEquals(new AlbumRow(100, "Abbey Road", "The Beatles", 1969, 1000L), result.rows().get(0));
            assertNull(((AlbumRow) run(LibraryCommand.ALBUMS, PageWindow.SINGLE, LibraryQuery.ALBUM_ID, "102")
                .rows().get(0)).artworkTrackId());
        }

        @Test
        @DisplayName("should list genres and years in order")
        void shouldListGenresAndYears() {
            assertEquals(List.of("Jazz", "Rock"), map(run(LibraryCommand.GENRES, ALL), GenreRow::genre));
            assertEquals(List.of(1959, 1969, 1997), map(run(LibraryCommand.YEARS, ALL), YearRow::year));
        }

        @Test
        @DisplayName("should list album tracks by track number with full details")
        void shouldListAlbumTracks() {
            LibraryResult result = run(LibraryCommand.TITLES, ALL,
                LibraryQuery.ALBUM_ID, "102", LibraryQuery.SORT, LibraryQuery.SORT_TRACKNUM);

            assertEquals(2, result.count());
            assertEquals(List.of("Airbag", "Paranoid Android"), map(result, TrackRow::title));
            TrackRow airbag = (TrackRow) result.rows().get(0);
            assertEquals("Radiohead", airbag.artist());
            assertEquals("OK Computer", airbag.album());
            assertEquals("Rock", airbag.genre());
            assertEquals(320000, airbag.bitrate());
        }

        @Test
        @DisplayName("should page while counting every row")
        void shouldPageTracks() {
            LibraryResult result = run(LibraryCommand.TITLES, PageWindow.of(1, 2));

            assertEquals(5, result.count());
            assertEquals(List.of("Come Together", "Paranoid Android"), map(result, TrackRow::title));
        }

        @Test
        @DisplayName("should keep playlist order")
        void shouldListPlaylistTracks() {
            LibraryResult result = run(LibraryCommand.PLAYLIST_TRACKS, ALL, LibraryQuery.PLAYLIST_ID, "500");

            assertEquals(2, result.count());
            assertEquals(List.of(1003L, 1000L), map(result, TrackRow::id));
        }

        @Test
        @DisplayName("should list folder entries with track ids for tracks")
        void shouldListFolders() {
            assertEquals(List.of("Beatles", "Miles Davis"),
                map(run(LibraryCommand.MUSICFOLDER, ALL), FolderRow::filename));

            LibraryResult beatles = run(LibraryCommand.MUSICFOLDER, ALL, LibraryQuery.FOLDER_ID, "1");
            assertEquals(List.of(
                new FolderRow(1000, "01 Come Together.mp3", FolderRow.TYPE_TRACK),
                new FolderRow(1001, "02 Something.mp3", FolderRow.TYPE_TRACK),
                new FolderRow(4, "mix.m3u", FolderRow.TYPE_PLAYLIST)), beatles.rows());

            LibraryResult top = run(LibraryCommand.MUSICFOLDER, PageWindow.SINGLE,
                LibraryQuery.FOLDER_ID, "2", LibraryQuery.RETURN_TOP, "1");
            assertEquals(List.of(new FolderRow(2, "Miles Davis", FolderRow.TYPE_FOLDER)), top.rows());
        }

        @Test
        @DisplayName("should fetch track details in one batch")
        void shouldFetchTrackDetails() {
            Map<Long, TrackRow> tracks = library.trackDetails(List.of(1002L, 9999L));

            assertEquals(Set.of(1002L), tracks.keySet());
            assertEquals("Miles Davis", tracks.get(1002L).artist());
            assertTrue(library.trackDetails(List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Video and pictures")
    class MediaTests {

        @Test
        @DisplayName("should list videos by title")
        void shouldListVideos() {
            assertEquals(List.of("Birthday", "Holiday"), map(run(LibraryCommand.VIDEO_TITLES, ALL), VideoRow::title));
            assertEquals(List.of("a1b2c3d4"), map(run(LibraryCommand.VIDEO_TITLES, PageWindow.SINGLE,
                LibraryQuery.VIDEO_ID, "a1b2c3d4"), VideoRow::hash));
        }

        @Test
        @DisplayName("should group pictures along the timeline")
        void shouldGroupTimeline() {
            assertEquals(List.of(new ImageGroupRow("2021", "2021")),
                run(LibraryCommand.IMAGE_TITLES, ALL, LibraryQuery.TIMELINE, "years").rows());
            assertEquals(List.of(new ImageGroupRow("01", "2021-01"), new ImageGroupRow("07", "2021-07")),
                run(LibraryCommand.IMAGE_TITLES, ALL, LibraryQuery.TIMELINE, "months", LibraryQuery.SEARCH, "2021").rows());
            assertEquals(List.of("01", "02"), map(run(LibraryCommand.IMAGE_TITLES, ALL,
                LibraryQuery.TIMELINE, "days", LibraryQuery.SEARCH, "2021-07"), ImageGroupRow::id));
            assertEquals(List.of("Beach"), map(run(LibraryCommand.IMAGE_TITLES, ALL,
                LibraryQuery.TIMELINE, "day", LibraryQuery.SEARCH, "2021-07-01"), ImageRow::title));
        }

        @Test
        @DisplayName("should group pictures by date and album")
        void shouldGroupDatesAndAlbums() {
            assertEquals(List.of("2021-01-01", "2021-07-01", "2021-07-02"), map(run(LibraryCommand.IMAGE_TITLES, ALL,
                LibraryQuery.TIMELINE, "dates"), ImageGroupRow::title));
            assertEquals(List.of(new ImageGroupRow("Summer+2021", "Summer 2021"), new ImageGroupRow("Winter", "Winter")),
                run(LibraryCommand.IMAGE_TITLES, ALL, LibraryQuery.TIMELINE, "albums").rows());
            assertEquals(List.of("Beach", "Sunset"), map(run(LibraryCommand.IMAGE_TITLES, ALL,
                LibraryQuery.ALBUM, "Summer 2021"), ImageRow::title));
        }

        @Test
        @DisplayName("should describe a single group")
        void shouldDescribeGroup() {
            LibraryResult month = run(LibraryCommand.IMAGE_TITLES, PageWindow.SINGLE,
                LibraryQuery.TIMELINE, "months", LibraryQuery.SEARCH, "2021", LibraryQuery.GROUP, "07");

            assertEquals(1, month.count());
            assertEquals(new ImageGroupRow("07", "2021-07"), month.rows().get(0));
            assertEquals(0, run(LibraryCommand.IMAGE_TITLES, PageWindow.SINGLE,
                LibraryQuery.TIMELINE, "years", LibraryQuery.GROUP, "1999").count());
        }

        @Test
        @DisplayName("should reject unknown timelines")
        void shouldRejectUnknownTimeline() {
            assertThrows(LibraryException.class,
                () -> run(LibraryCommand.IMAGE_TITLES, ALL, LibraryQuery.TIMELINE, "decades"));
        }
    }

    @Nested
    @DisplayName("Search")
    class SearchTests {

        @Test
        @DisplayName("should run decoded track predicates")
        void shouldSearchTracks() {
            LibraryResult result = library.search(new LibrarySearch(SearchTable.TRACKS,
                "genres.namesearch LIKE ? ESCAPE '\\'", List.of("%ROCK%"), "tracks.titlesort ASC",
                Set.of(LibrarySearch.TAG_ARTIST, LibrarySearch.TAG_ALBUM, LibrarySearch.TAG_GENRE), ALL));

            assertEquals(4, result.count());
            assertEquals(List.of("Airbag", "Come Together", "Paranoid Android", "Something"),
                map(result, TrackRow::title));
        }

        @Test
        @DisplayName("should search pictures by hash")
        void shouldSearchImages() {
            LibraryResult result = library.search(new LibrarySearch(SearchTable.IMAGES,
                "images.hash = ?", List.of("33333333"), "", Set.of(), ALL));

            assertEquals(LibraryCommand.IMAGE_TITLES, result.command());
            assertEquals(List.of("Snow"), map(result, ImageRow::title));
        }

        @Test
        @DisplayName("should report SQL failures as library errors")
        void shouldWrapSqlErrors() {
            assertThrows(LibraryException.class, () -> library.search(new LibrarySearch(SearchTable.TRACKS,
                "no_such_column = ?", List.of(1), "", Set.of(), ALL)));
        }
    }

    @Test
    @DisplayName("should remember the last scan time")
    void shouldReadLastScanTime() {
        assertEquals(SCAN_TIME, library.lastScanTime());
    }
}
