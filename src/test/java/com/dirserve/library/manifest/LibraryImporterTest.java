/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library.manifest;

import com.dirserve.db.DatabaseManager;
import com.dirserve.db.LibrarySchema;
import com.dirserve.library.LibraryCommand;
import com.dirserve.library.LibraryException.ManifestException;
import com.dirserve.library.LibraryQuery;
import com.dirserve.library.LibraryResult;
import com.dirserve.library.LibraryRows.ImageGroupRow;
import com.dirserve.library.PageWindow;
import com.dirserve.library.ScanListener;
import com.dirserve.library.sqlite.SqliteMediaLibrary;
import com.dirserve.library.manifest.LibraryImporter.ImportSummary;
import com.dirserve.test.TestConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("LibraryImporter")
class LibraryImporterTest {

    @TempDir
    Path tempDir;

    @Mock
    private ScanListener listener;

    private final AtomicLong clock = new AtomicLong(1_700_000_000L);
    private DatabaseManager databaseManager;
    private LibraryImporter importer;

    @BeforeEach
    void setUp() throws SQLException {
        MockitoAnnotations.openMocks(this);
        databaseManager = new DatabaseManager(tempDir.resolve("library.db").toString(), 2);
        LibrarySchema.initializeSchema(databaseManager);
        importer = new LibraryImporter(databaseManager, clock::get);
        importer.addScanListener(listener);
    }

    @AfterEach
    void tearDown() {
        databaseManager.close();
    }

    @Nested
    @DisplayName("Importing")
    class ImportTests {

        @Test
        @DisplayName("should load every section of the manifest")
        void shouldImportResource() {
            ImportSummary summary = importer.importResource(TestConfig.TEST_LIBRARY);

            assertEquals(new ImportSummary(3, 3, 2, 5, 6, 1, 2, 3, 1_700_000_000L), summary);
            assertEquals(1_700_000_000L, new SqliteMediaLibrary(databaseManager).lastScanTime());
            verify(listener).rescanCompleted(1_700_000_000L);
        }

        @Test
        @DisplayName("should replace the previous library on rescan")
        void shouldReplaceOnRescan() throws IOException {
            importer.importResource(TestConfig.TEST_LIBRARY);

            Path small = tempDir.resolve("small.json");
            Files.writeString(small, """
                {"artists": [{"id": 7, "name": "Nina Simone"}],
                 "tracks": [{"id": 1, "url": "file:///a.mp3", "title": "Feeling Good", "artistId": 7}]}
                """);
            clock.set(1_700_000_500L);
            ImportSummary summary = importer.importFile(small);

            assertEquals(1, summary.tracks());
            assertEquals(0, summary.albums());
            verify(listener).rescanCompleted(1_700_000_500L);
            assertEquals(1_700_000_500L, new SqliteMediaLibrary(databaseManager).lastScanTime());
        }

        @Test
        @DisplayName("should leave pictures with a blank album out of the album listing")
        void shouldSkipBlankImageAlbums() throws IOException {
            Path pictures = tempDir.resolve("pictures.json");
            Files.writeString(pictures, """
                {"images": [
                  {"hash": "aaaa0001", "url": "file:///a.jpg", "title": "A", "album": "Beach"},
                  {"hash": "aaaa0002", "url": "file:///b.jpg", "title": "B", "album": ""},
                  {"hash": "aaaa0003", "url": "file:///c.jpg", "title": "C"}
                ]}
                """);
            importer.importFile(pictures);

            LibraryResult albums = new SqliteMediaLibrary(databaseManager).execute(
                LibraryQuery.builder(LibraryCommand.IMAGE_TITLES, PageWindow.of(0, 0))
                    .param(LibraryQuery.TIMELINE, "albums")
                    .build());

            assertEquals(1, albums.count());
            assertEquals(List.of(new ImageGroupRow("Beach", "Beach")), albums.rows());
        }

        @Test
        @DisplayName("should keep going when a listener fails")
        void shouldIsolateListenerFailures() {
            doThrow(new IllegalStateException("listener down")).when(listener).rescanCompleted(anyLong());

            assertDoesNotThrow(() -> importer.importResource(TestConfig.TEST_LIBRARY));
        }
    }

    @Nested
    @DisplayName("Invalid manifests")
    class InvalidManifestTests {

        @Test
        @DisplayName("should reject a missing file")
        void shouldRejectMissingFile() {
            assertThrows(ManifestException.class, () -> importer.importFile(tempDir.resolve("absent.json")));
            verifyNoInteractions(listener);
        }

        @Test
        @DisplayName("should reject malformed JSON")
        void shouldRejectMalformedJson() throws IOException {
            Path broken = tempDir.resolve("broken.json");
            Files.writeString(broken, "{\"tracks\": [");

            assertThrows(ManifestException.class, () -> importer.importFile(broken));
        }

        @Test
        @DisplayName("should reject unknown folder entry types")
        void shouldRejectBadFolderType() throws IOException {
            Path bad = tempDir.resolve("bad.json");
            Files.writeString(bad, "{\"folders\": [{\"id\": 1, \"filename\": \"x\", \"type\": \"symlink\"}]}");

            ManifestException e = assertThrows(ManifestException.class, () -> importer.importFile(bad));
            assertTrue(e.getMessage().contains("symlink"));
        }

        @Test
        @DisplayName("should reject media hashes that cannot appear in object IDs")
        void shouldRejectMalformedHashes() throws IOException {
            Path video = tempDir.resolve("video.json");
            Files.writeString(video, "{\"videos\": [{\"hash\": \"VID-0001\", \"url\": \"file:///v.mp4\"}]}");
            ManifestException e = assertThrows(ManifestException.class, () -> importer.importFile(video));
            assertTrue(e.getMessage().contains("VID-0001"));

            Path image = tempDir.resolve("image.json");
            Files.writeString(image, "{\"images\": [{\"hash\": \"0A1B2C3D\", \"url\": \"file:///i.jpg\"}]}");
            assertThrows(ManifestException.class, () -> importer.importFile(image));
            verifyNoInteractions(listener);
        }

        @Test
        @DisplayName("should leave the old library in place when the write fails")
        void shouldRollBack() throws IOException {
            importer.importResource(TestConfig.TEST_LIBRARY);

            Path dangling = tempDir.resolve("dangling.json");
            Files.writeString(dangling,
                "{\"tracks\": [{\"id\": 1, \"url\": \"file:///a.mp3\", \"title\": \"A\", \"albumId\": 999}]}");

            assertThrows(ManifestException.class, () -> importer.importFile(dangling));
            assertEquals(5, new SqliteMediaLibrary(databaseManager).trackDetails(
                java.util.List.of(1000L, 1001L, 1002L, 1003L, 1004L)).size());
        }
    }

    @Test
    @DisplayName("should build sort keys without leading articles")
    void shouldBuildSortKeys() {
        assertEquals("BEATLES", LibraryImporter.sortKey("The Beatles"));
        assertEquals("ANTHEM", LibraryImporter.sortKey("Anthem"));
        assertEquals("THE", LibraryImporter.sortKey("The"));
        assertEquals("HARD DAY'S NIGHT", LibraryImporter.sortKey(" A Hard Day's Night"));
        assertNull(LibraryImporter.sortKey(null));
        assertEquals("MILES DAVIS", LibraryImporter.searchKey("Miles Davis"));
    }
}
