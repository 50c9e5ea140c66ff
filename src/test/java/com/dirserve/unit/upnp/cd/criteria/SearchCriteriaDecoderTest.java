/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.unit.upnp.cd.criteria;

import com.dirserve.library.LibrarySearch;
import com.dirserve.library.SearchTable;
import com.dirserve.upnp.cd.criteria.SearchCriteriaDecoder;
import com.dirserve.upnp.cd.criteria.SearchQuery;
import com.dirserve.upnp.cd.criteria.UnsupportedCriteriaException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SearchCriteriaDecoder")
class SearchCriteriaDecoderTest {

    private final SearchCriteriaDecoder decoder = new SearchCriteriaDecoder();

    @Nested
    @DisplayName("Track searches")
    class TrackSearchTests {

        @Test
        @DisplayName("should match everything for an asterisk")
        void shouldMatchAll() throws UnsupportedCriteriaException {
            SearchQuery query = decoder.decode("*");

            assertEquals(SearchTable.TRACKS, query.table());
            assertEquals("1=1", query.predicate());
            assertTrue(query.parameters().isEmpty());
        }

        @Test
        @DisplayName("should bind a genre contains match")
        void shouldDecodeGenreContains() throws UnsupportedCriteriaException {
            SearchQuery query = decoder.decode("upnp:genre contains \"Rock\"");

            assertEquals(SearchTable.TRACKS, query.table());
            assertEquals("genres.namesearch LIKE ? ESCAPE '\\'", query.predicate());
            assertEquals(List.of("%ROCK%"), query.parameters());
            assertEquals(Set.of(LibrarySearch.TAG_GENRE), query.tags());
        }

        @Test
        @DisplayName("should keep class constraints out of the predicate")
        void shouldDecodeClassAndTitle() throws UnsupportedCriteriaException {
            SearchQuery query = decoder.decode(
                "(upnp:class derivedfrom \"object.item.audioItem\" and dc:title contains \"come\")");

            assertEquals(SearchTable.TRACKS, query.table());
            assertEquals("(1=1 AND tracks.titlesearch LIKE ? ESCAPE '\\')", query.predicate());
            assertEquals(List.of("%COME%"), query.parameters());
        }

        @Test
        @DisplayName("should give and precedence over or")
        void shouldNestJunctions() throws UnsupportedCriteriaException {
            SearchQuery query = decoder.decode(
                "dc:creator = \"Radiohead\" or upnp:album startsWith \"Kind\" and dc:title doesNotContain \"So\"");

            assertEquals("(contributors.namesearch = ? OR (albums.titlesearch LIKE ? ESCAPE '\\'"
                + " AND tracks.titlesearch NOT LIKE ? ESCAPE '\\'))", query.predicate());
            assertEquals(List.of("RADIOHEAD", "KIND%", "%SO%"), query.parameters());
            assertEquals(Set.of(LibrarySearch.TAG_ARTIST, LibrarySearch.TAG_ALBUM), query.tags());
        }

        @Test
        @DisplayName("should escape LIKE wildcards in values")
        void shouldEscapeWildcards() throws UnsupportedCriteriaException {
            SearchQuery query = decoder.decode("dc:title contains \"100%_\"");

            assertEquals(List.of("%100\\%\\_%"), query.parameters());
        }

        @Test
        @DisplayName("should unescape XML entities and quoted characters")
        void shouldUnescape() throws UnsupportedCriteriaException {
            SearchQuery query = decoder.decode("dc:title = &quot;say \\\"hi\\\"&quot;");

            assertEquals(List.of("SAY \"HI\""), query.parameters());
        }

        @Test
        @DisplayName("should bind numbers for track ids and update times")
        void shouldBindNumbers() throws UnsupportedCriteriaException {
            SearchQuery query = decoder.decode("@id = \"1000\" and pv:lastUpdated > \"1500\"");

            assertEquals("(tracks.id = ? AND tracks.updated_time > ?)", query.predicate());
            assertEquals(List.of(1000L, 1500L), query.parameters());
            assertTrue(query.tags().contains(LibrarySearch.TAG_UPDATED));
        }

        @Test
        @DisplayName("should translate exists checks")
        void shouldDecodeExists() throws UnsupportedCriteriaException {
            assertEquals("genres.namesearch IS NOT NULL", decoder.decode("upnp:genre exists true").predicate());
            assertEquals("genres.namesearch IS NULL", decoder.decode("upnp:genre exists false").predicate());
            assertEquals("1=1", decoder.decode("@refID exists false").predicate());
        }
    }

    @Nested
    @DisplayName("Video and picture searches")
    class MediaSearchTests {

        @Test
        @DisplayName("should search videos for a video class")
        void shouldSelectVideos() throws UnsupportedCriteriaException {
            SearchQuery query = decoder.decode(
                "upnp:class derivedfrom \"object.item.videoItem\" and dc:title contains \"holi\"");

            assertEquals(SearchTable.VIDEOS, query.table());
            assertEquals("(1=1 AND videos.titlesearch LIKE ? ESCAPE '\\')", query.predicate());
        }

        @Test
        @DisplayName("should search images by hash")
        void shouldSelectImages() throws UnsupportedCriteriaException {
            SearchQuery query = decoder.decode(
                "upnp:class = \"object.item.imageItem.photo\" and @id = \"11111111\"");

            assertEquals(SearchTable.IMAGES, query.table());
            assertEquals(List.of("11111111"), query.parameters());
        }

        @Test
        @DisplayName("should reject audio properties on pictures")
        void shouldRejectAudioPropertyOnImages() {
            assertThrows(UnsupportedCriteriaException.class, () -> decoder.decode(
                "upnp:class derivedfrom \"object.item.imageItem\" and upnp:artist contains \"x\""));
        }
    }

    @Nested
    @DisplayName("Invalid criteria")
    class InvalidCriteriaTests {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
            "dc:title contains",
            "dc:title contains \"open",
            "(dc:title = \"a\"",
            "dc:title = \"a\")",
            "dc:title like \"a\"",
            "dc:title = unquoted",
            "upnp:rating = \"5\"",
            "dc:title derivedfrom \"x\"",
            "@id contains \"1\"",
            "@id = \"abc\"",
            "upnp:genre exists maybe",
            "dc:title = \"a\" xor dc:title = \"b\""
        })
        @DisplayName("should reject malformed or unsupported criteria")
        void shouldReject(String criteria) {
            assertThrows(UnsupportedCriteriaException.class, () -> decoder.decode(criteria));
        }
    }
}
