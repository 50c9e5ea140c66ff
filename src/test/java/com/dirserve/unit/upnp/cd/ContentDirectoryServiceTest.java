/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.unit.upnp.cd;

import com.dirserve.library.LibraryCommand;
import com.dirserve.library.LibraryException;
import com.dirserve.library.LibraryQuery;
import com.dirserve.library.LibraryResult;
import com.dirserve.library.LibraryRows.AlbumRow;
import com.dirserve.library.LibraryRows.GenreRow;
import com.dirserve.library.LibraryRows.LibraryRow;
import com.dirserve.library.LibraryRows.TrackRow;
import com.dirserve.library.LibraryRows.VideoRow;
import com.dirserve.library.LibrarySearch;
import com.dirserve.library.MediaLibrary;
import com.dirserve.library.SearchTable;
import com.dirserve.upnp.cd.BrowseRequest;
import com.dirserve.upnp.cd.BrowseResult;
import com.dirserve.upnp.cd.ContentDirectoryService;
import com.dirserve.upnp.cd.PathGrammar;
import com.dirserve.upnp.cd.QueryTranslator;
import com.dirserve.upnp.cd.SearchRequest;
import com.dirserve.upnp.cd.StaticMenus;
import com.dirserve.upnp.cd.UpnpFault;
import com.dirserve.upnp.cd.criteria.SearchCriteriaDecoder;
import com.dirserve.upnp.cd.criteria.SortCriteriaDecoder;
import com.dirserve.upnp.cd.didl.DidlRenderer;
import com.dirserve.upnp.cd.event.ContentDirectoryState;
import org.jupnp.support.contentdirectory.DIDLParser;
import org.jupnp.support.model.DIDLContent;
import org.jupnp.support.model.container.Container;
import org.jupnp.support.model.item.Item;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("ContentDirectoryService")
class ContentDirectoryServiceTest {

    @Mock
    private MediaLibrary library;

    private ContentDirectoryState state;
    private ContentDirectoryService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        state = new ContentDirectoryState(42);
        service = new ContentDirectoryService(library, state, new PathGrammar(), new QueryTranslator(100),
            new SearchCriteriaDecoder(), new SortCriteriaDecoder(),
            new DidlRenderer(library, "http://127.0.0.1:9000"), new StaticMenus("Test"));
    }

    private static BrowseRequest children(String objectId, long start, long count) {
        return new BrowseRequest(objectId, "BrowseDirectChildren", "*", start, count, "");
    }

    private static BrowseRequest metadata(String objectId) {
        return new BrowseRequest(objectId, "BrowseMetadata", "*", 0, 0, "");
    }

    private static List<String[]> containers(String xml) {
        List<String[]> ids = new ArrayList<>();
        for (Container container : parse(xml).getContainers()) {
            ids.add(new String[] {container.getId(), container.getParentID()});
        }
        return ids;
    }

    private static List<String[]> items(String xml) {
        List<String[]> ids = new ArrayList<>();
        for (Item item : parse(xml).getItems()) {
            ids.add(new String[] {item.getId(), item.getParentID()});
        }
        return ids;
    }

    private static DIDLContent parse(String xml) {
        try {
            return new DIDLParser().parse(xml);
        } catch (Exception e) {
            throw new AssertionError("Unparseable DIDL-Lite: " + xml, e);
        }
    }

    private static TrackRow track(long id, String title) {
        return new TrackRow(id, "file:///" + id, title, 1, 100.0, 1997, "audio/mpeg", null, null, null,
            102L, "OK Computer", null, 3L, "Radiohead", "Rock", 0, 0, 0);
    }

    @Nested
    @DisplayName("Browse")
    class BrowseTests {

        @Test
        @DisplayName("should page genres and report the full total")
        void shouldPageGenres() {
            List<LibraryRow> genres = new ArrayList<>();
            for (int i = 1; i <= 10; i++) {
                genres.add(new GenreRow(i, "Genre " + i));
            }
            when(library.execute(any())).thenReturn(new LibraryResult(LibraryCommand.GENRES, genres, 25));

            BrowseResult result = service.browse(children("/g", 0, 10));

            assertEquals(10, result.numberReturned());
            assertEquals(25, result.totalMatches());
            assertEquals(42, result.updateId());
            List<String[]> ids = containers(result.result());
            assertEquals(10, ids.size());
            for (int i = 0; i < ids.size(); i++) {
                assertEquals("/g/" + (i + 1) + "/a", ids.get(i)[0]);
                assertEquals("/g", ids.get(i)[1]);
            }
        }

        @Test
        @DisplayName("should describe a listed child with the listing as parent")
        void shouldRoundTripMetadata() {
            AlbumRow album = new AlbumRow(7, "OK Computer", "Radiohead", 1997, null);
            when(library.execute(any())).thenReturn(new LibraryResult(LibraryCommand.ALBUMS, List.of(album), 1));

            String childId = containers(service.browse(children("/a/3/l", 0, 0)).result()).get(0)[0];
            assertEquals("/a/3/l/7/t", childId);

            BrowseResult described = service.browse(metadata(childId));
            assertEquals(1, described.numberReturned());
            assertEquals(1, described.totalMatches());
            assertArrayEquals(new String[] {"/a/3/l/7/t", "/a/3/l"}, containers(described.result()).get(0));
        }

        @Test
        @DisplayName("should describe a listed video by its hash")
        void shouldRoundTripVideoMetadata() {
            VideoRow video = new VideoRow("a1b2c3d4", "file:///video/trip.mp4", "Road Trip", "Trips", "video/mp4",
                95.0, 1280, 720, 1000L, 1600000000L, 0L);
            when(library.execute(any())).thenReturn(new LibraryResult(LibraryCommand.VIDEO_TITLES, List.of(video), 1));

            String childId = items(service.browse(children("/va", 0, 0)).result()).get(0)[0];
            assertEquals("/va/a1b2c3d4", childId);

            BrowseResult described = service.browse(metadata(childId));
            assertEquals(1, described.numberReturned());
            assertArrayEquals(new String[] {"/va/a1b2c3d4", "/va"}, items(described.result()).get(0));
        }

        @Test
        @DisplayName("should serve menus without touching the library")
        void shouldServeMenus() {
            BrowseResult root = service.browse(children("0", 0, 0));
            assertEquals(3, root.numberReturned());
            assertEquals("/music", containers(root.result()).get(0)[0]);

            BrowseResult music = service.browse(children("/music", 2, 2));
            assertEquals(2, music.numberReturned());
            assertEquals(7, music.totalMatches());

            BrowseResult mountRoot = service.browse(metadata("/a"));
            assertArrayEquals(new String[] {"/a", "/music"}, containers(mountRoot.result()).get(0));

            verifyNoInteractions(library);
        }

        @Test
        @DisplayName("should cap new music at the age limit")
        void shouldCapNewMusic() {
            when(library.execute(any())).thenReturn(new LibraryResult(LibraryCommand.ALBUMS,
                List.of(new AlbumRow(1, "A", null, 0, null)), 500));

            BrowseResult result = service.browse(children("/n", 0, 0));

            assertEquals(100, result.totalMatches());
            ArgumentCaptor<LibraryQuery> query = ArgumentCaptor.forClass(LibraryQuery.class);
            verify(library).execute(query.capture());
            assertEquals(100, query.getValue().page().limit());
        }

        @Test
        @DisplayName("should answer in native order when the sort is unsupported")
        void shouldIgnoreUnsupportedSort() {
            when(library.execute(any())).thenReturn(new LibraryResult(LibraryCommand.GENRES,
                List.of(new GenreRow(1, "Rock")), 1));

            BrowseResult result = service.browse(new BrowseRequest("/g", "BrowseDirectChildren", "", 0, 0, "-upnp:genre"));

            assertEquals(1, result.numberReturned());
        }

        @Test
        @DisplayName("should return nothing for children of an item")
        void shouldReturnNothingForItemChildren() {
            BrowseResult result = service.browse(children("/t/1000", 0, 0));

            assertEquals("", result.result());
            assertEquals(0, result.numberReturned());
            assertEquals(0, result.totalMatches());
            verifyNoInteractions(library);
        }

        @Test
        @DisplayName("should fault with 701 for malformed and missing objects")
        void shouldFaultForMissingObjects() {
            assertEquals(701, assertThrows(UpnpFault.class, () -> service.browse(children("/nope", 0, 0))).getCode());

            when(library.execute(any())).thenReturn(LibraryResult.empty(LibraryCommand.ALBUMS));
            assertEquals(701, assertThrows(UpnpFault.class, () -> service.browse(metadata("/l/999/t"))).getCode());
        }

        @Test
        @DisplayName("should fault with 720 for a bad flag or backend failure")
        void shouldFaultForProcessingErrors() {
            BrowseRequest badFlag = new BrowseRequest("/a", "BrowseEverything", "*", 0, 0, "");
            assertEquals(720, assertThrows(UpnpFault.class, () -> service.browse(badFlag)).getCode());

            when(library.execute(any())).thenThrow(new LibraryException("database is locked"));
            assertEquals(720, assertThrows(UpnpFault.class, () -> service.browse(children("/a", 0, 0))).getCode());
        }
    }

    @Nested
    @DisplayName("Search")
    class SearchTests {

        @Test
        @DisplayName("should search tracks and name results under the track mount")
        void shouldSearchTracks() {
            when(library.search(any())).thenReturn(new LibraryResult(LibraryCommand.TITLES,
                List.of(track(1003, "Paranoid Android")), 1));

            BrowseResult result = service.search(new SearchRequest("0",
                "upnp:class derivedfrom \"object.item.audioItem\" and dc:title contains \"android\"",
                "*", 0, 10, "+dc:title"));

            assertEquals(1, result.numberReturned());
            assertArrayEquals(new String[] {"/t/1003", "/t"}, items(result.result()).get(0));

            ArgumentCaptor<LibrarySearch> search = ArgumentCaptor.forClass(LibrarySearch.class);
            verify(library).search(search.capture());
            assertEquals(SearchTable.TRACKS, search.getValue().table());
            assertEquals("tracks.titlesort ASC", search.getValue().orderBy());
            assertTrue(search.getValue().hasTag(LibrarySearch.TAG_ARTIST));
            assertEquals(List.of("%ANDROID%"), search.getValue().parameters());
        }

        @Test
        @DisplayName("should fault with 708 for bad criteria, sort or container")
        void shouldFaultForUnsupportedSearches() {
            assertEquals(708, assertThrows(UpnpFault.class, () -> service.search(
                new SearchRequest("0", "dc:title likes \"x\"", "*", 0, 0, ""))).getCode());
            assertEquals(708, assertThrows(UpnpFault.class, () -> service.search(
                new SearchRequest("0", "*", "*", 0, 0, "+upnp:rating"))).getCode());
            assertEquals(708, assertThrows(UpnpFault.class, () -> service.search(
                new SearchRequest("/music", "*", "*", 0, 0, ""))).getCode());
            verifyNoInteractions(library);
        }
    }

    @Test
    @DisplayName("should report capabilities and the update id")
    void shouldReportCapabilities() {
        assertTrue(service.getSearchCapabilities().contains("upnp:genre"));
        assertTrue(service.getSortCapabilities().contains("upnp:originalTrackNumber"));

        state.updateRevision(50);
        assertEquals(50, service.getSystemUpdateId());
    }
}
