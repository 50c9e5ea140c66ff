/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.unit.upnp.cd;

import com.dirserve.library.LibraryCommand;
import com.dirserve.library.LibraryQuery;
import com.dirserve.library.PageWindow;
import com.dirserve.upnp.cd.BrowseFlag;
import com.dirserve.upnp.cd.InvalidPathException;
import com.dirserve.upnp.cd.PathGrammar;
import com.dirserve.upnp.cd.QueryTranslator;
import com.dirserve.upnp.cd.RowTemplate;
import com.dirserve.upnp.cd.TranslatedQuery;
import com.dirserve.upnp.cd.UpnpFault;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryTranslator")
class QueryTranslatorTest {

    private static final PageWindow PAGE = new PageWindow(0, 10);

    private final PathGrammar grammar = new PathGrammar();
    private final QueryTranslator translator = new QueryTranslator(50);

    private TranslatedQuery children(String objectId) throws InvalidPathException {
        return translator.translate(grammar.parse(objectId), BrowseFlag.BROWSE_DIRECT_CHILDREN, PAGE, "");
    }

    private TranslatedQuery metadata(String objectId) throws InvalidPathException {
        return translator.translate(grammar.parse(objectId), BrowseFlag.BROWSE_METADATA, PAGE, "");
    }

    @Nested
    @DisplayName("BrowseDirectChildren")
    class ChildrenTests {

        @Test
        @DisplayName("should list artists at the artist mount")
        void shouldListArtists() throws InvalidPathException {
            TranslatedQuery translated = children("/a");

            assertEquals(LibraryCommand.ARTISTS, translated.query().command());
            assertEquals(RowTemplate.ARTIST, translated.template());
            assertEquals(PAGE, translated.query().page());
            assertEquals(TranslatedQuery.TITLE_SORT, translated.nativeSort());
        }

        @Test
        @DisplayName("should list an artist's albums within a genre")
        void shouldListAlbumsOfArtistInGenre() throws InvalidPathException {
            LibraryQuery query = children("/g/3/a/5/l").query();

            assertEquals(LibraryCommand.ALBUMS, query.command());
            assertEquals("5", query.param(LibraryQuery.ARTIST_ID).orElseThrow());
            assertEquals("3", query.param(LibraryQuery.GENRE_ID).orElseThrow());
            assertEquals(LibraryQuery.SORT_ALBUM, query.param(LibraryQuery.SORT).orElseThrow());
        }

        @Test
        @DisplayName("should list album tracks in track-number order")
        void shouldListAlbumTracks() throws InvalidPathException {
            TranslatedQuery translated = children("/l/7/t");

            assertEquals(LibraryCommand.TITLES, translated.query().command());
            assertEquals("7", translated.query().param(LibraryQuery.ALBUM_ID).orElseThrow());
            assertEquals(LibraryQuery.SORT_TRACKNUM, translated.query().param(LibraryQuery.SORT).orElseThrow());
            assertEquals(TranslatedQuery.TRACK_NUMBER_SORT, translated.nativeSort());
            assertEquals(RowTemplate.TRACK, translated.template());
        }

        @Test
        @DisplayName("should cap new music at the age limit")
        void shouldCapNewMusic() throws InvalidPathException {
            TranslatedQuery translated = translator.translate(grammar.parse("/n"),
                BrowseFlag.BROWSE_DIRECT_CHILDREN, PageWindow.of(0, 0), "");

            assertEquals(50, translated.query().page().limit());
            assertEquals(50, translated.totalCap());
            assertEquals(LibraryQuery.SORT_NEW, translated.query().param(LibraryQuery.SORT).orElseThrow());
            assertNull(translated.nativeSort());
        }

        @Test
        @DisplayName("should list the contents of a nested folder")
        void shouldListFolder() throws InvalidPathException {
            TranslatedQuery translated = children("/m/4/m/8/m");

            assertEquals(LibraryCommand.MUSICFOLDER, translated.query().command());
            assertEquals("8", translated.query().param(LibraryQuery.FOLDER_ID).orElseThrow());
            assertEquals(RowTemplate.FOLDER, translated.template());
        }

        @Test
        @DisplayName("should step through the picture timeline")
        void shouldStepThroughTimeline() throws InvalidPathException {
            LibraryQuery years = children("/it").query();
            assertEquals("years", years.param(LibraryQuery.TIMELINE).orElseThrow());

            LibraryQuery months = children("/it/2021").query();
            assertEquals("months", months.param(LibraryQuery.TIMELINE).orElseThrow());
            assertEquals("2021", months.param(LibraryQuery.SEARCH).orElseThrow());

            LibraryQuery days = children("/it/2021/07").query();
            assertEquals("days", days.param(LibraryQuery.TIMELINE).orElseThrow());
            assertEquals("2021-07", days.param(LibraryQuery.SEARCH).orElseThrow());

            TranslatedQuery day = children("/it/2021/07/01");
            assertEquals("day", day.query().param(LibraryQuery.TIMELINE).orElseThrow());
            assertEquals("2021-07-01", day.query().param(LibraryQuery.SEARCH).orElseThrow());
            assertEquals(RowTemplate.IMAGE, day.template());
        }

        @Test
        @DisplayName("should list the pictures of a decoded album name")
        void shouldListPictureAlbum() throws InvalidPathException {
            LibraryQuery query = children("/il/Summer+2021").query();

            assertEquals(LibraryCommand.IMAGE_TITLES, query.command());
            assertEquals("Summer 2021", query.param(LibraryQuery.ALBUM).orElseThrow());
        }

        @Test
        @DisplayName("should return no rows for items and the video folder")
        void shouldReturnNoRows() throws InvalidPathException {
            assertFalse(children("/t/12").hasQuery());
            assertFalse(children("/va/a1b2c3d4").hasQuery());
            assertFalse(children("/v").hasQuery());
        }

        @Test
        @DisplayName("should refuse to list every track")
        void shouldRefuseTrackMount() throws InvalidPathException {
            UpnpFault fault = assertThrows(UpnpFault.class, () -> children("/t"));
            assertEquals(UpnpFault.NO_SUCH_OBJECT, fault.getCode());
        }

        @Test
        @DisplayName("should ignore an unsupported sort")
        void shouldIgnoreUnsupportedSort() throws InvalidPathException {
            TranslatedQuery translated = translator.translate(grammar.parse("/a"),
                BrowseFlag.BROWSE_DIRECT_CHILDREN, PAGE, "-dc:title");

            assertEquals(LibraryCommand.ARTISTS, translated.query().command());
            assertFalse(translated.query().hasParam(LibraryQuery.SORT));
        }
    }

    @Nested
    @DisplayName("BrowseMetadata")
    class MetadataTests {

        @Test
        @DisplayName("should look up a single album row")
        void shouldLookUpAlbum() throws InvalidPathException {
            TranslatedQuery translated = metadata("/a/5/l/7/t");

            assertEquals(LibraryCommand.ALBUMS, translated.query().command());
            assertEquals(PageWindow.SINGLE, translated.query().page());
            assertEquals("7", translated.query().param(LibraryQuery.ALBUM_ID).orElseThrow());
            assertEquals(RowTemplate.ALBUM, translated.template());
        }

        @Test
        @DisplayName("should ask for the folder itself")
        void shouldLookUpFolder() throws InvalidPathException {
            LibraryQuery query = metadata("/m/4/m").query();

            assertEquals("4", query.param(LibraryQuery.FOLDER_ID).orElseThrow());
            assertEquals("1", query.param(LibraryQuery.RETURN_TOP).orElseThrow());
        }

        @Test
        @DisplayName("should look up tracks by id in every mount")
        void shouldLookUpTrack() throws InvalidPathException {
            assertEquals("9", metadata("/g/3/a/5/l/7/t/9").query().param(LibraryQuery.TRACK_ID).orElseThrow());
            assertEquals("12", metadata("/m/4/t/12").query().param(LibraryQuery.TRACK_ID).orElseThrow());
        }

        @Test
        @DisplayName("should name the picture group being described")
        void shouldNameGroup() throws InvalidPathException {
            LibraryQuery month = metadata("/it/2021/07").query();
            assertEquals("months", month.param(LibraryQuery.TIMELINE).orElseThrow());
            assertEquals("2021", month.param(LibraryQuery.SEARCH).orElseThrow());
            assertEquals("07", month.param(LibraryQuery.GROUP).orElseThrow());

            LibraryQuery date = metadata("/id/2021/07/01").query();
            assertEquals("dates", date.param(LibraryQuery.TIMELINE).orElseThrow());
            assertEquals("2021/07/01", date.param(LibraryQuery.GROUP).orElseThrow());
        }

        @Test
        @DisplayName("should not describe mount roots")
        void shouldRejectMountRoot() {
            UpnpFault fault = assertThrows(UpnpFault.class, () -> metadata("/a"));
            assertEquals(UpnpFault.NO_SUCH_OBJECT, fault.getCode());
        }
    }
}
