/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library;

/**
 * Row shapes returned by the library, one per result loop.
 */
public final class LibraryRows {

    private LibraryRows() {}

    /** Marker for every row type. */
    public interface LibraryRow {}

    public record ArtistRow(long id, String artist) implements LibraryRow {}

    /**
     * @param artworkTrackId track whose embedded cover stands for the album, or null
     */
    public record AlbumRow(long id, String album, String artist, int year, Long artworkTrackId)
        implements LibraryRow {}

    public record GenreRow(long id, String genre) implements LibraryRow {}

    /** Year 0 collects albums without a known year. */
    public record YearRow(int year) implements LibraryRow {}

    /**
     * A music folder entry. For {@code track} entries the id is the track id.
     */
    public record FolderRow(long id, String filename, String type) implements LibraryRow {
        public static final String TYPE_FOLDER = "folder";
        public static final String TYPE_PLAYLIST = "playlist";
        public static final String TYPE_TRACK = "track";
        public static final String TYPE_UNKNOWN = "unknown";
    }

    public record TrackRow(
        long id,
        String url,
        String title,
        Integer tracknum,
        Double secs,
        int year,
        String contentType,
        Integer bitrate,
        Integer samplerate,
        Long filesize,
        Long albumId,
        String album,
        Long artworkTrackId,
        Long artistId,
        String artist,
        String genre,
        long timestamp,
        long addedTime,
        long updatedTime
    ) implements LibraryRow {}

    public record PlaylistRow(long id, String playlist) implements LibraryRow {}

    public record VideoRow(
        String hash,
        String url,
        String title,
        String album,
        String mimeType,
        Double secs,
        Integer width,
        Integer height,
        Long filesize,
        long mtime,
        long updatedTime
    ) implements LibraryRow {}

    public record ImageRow(
        String hash,
        String url,
        String title,
        String album,
        String mimeType,
        Integer width,
        Integer height,
        Long filesize,
        long originalTime,
        long mtime,
        long updatedTime
    ) implements LibraryRow {}

    /**
     * A grouping of images (a year, month, day, date or album) rendered as a container.
     *
     * @param id    the path segment(s) this group contributes to child object ids
     * @param title display title
     */
    public record ImageGroupRow(String id, String title) implements LibraryRow {}
}
