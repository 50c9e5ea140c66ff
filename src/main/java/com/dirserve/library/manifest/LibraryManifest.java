/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library.manifest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON description of a scanned library, produced by an external scanner and
 * loaded wholesale on every rescan. Missing lists are treated as empty.
 */
public record LibraryManifest(
    @JsonProperty("artists") List<Named> artists,
    @JsonProperty("genres") List<Named> genres,
    @JsonProperty("albums") List<Album> albums,
    @JsonProperty("tracks") List<Track> tracks,
    @JsonProperty("folders") List<Folder> folders,
    @JsonProperty("playlists") List<Playlist> playlists,
    @JsonProperty("videos") List<Video> videos,
    @JsonProperty("images") List<Image> images
) {

    public LibraryManifest {
        artists = artists == null ? List.of() : artists;
        genres = genres == null ? List.of() : genres;
        albums = albums == null ? List.of() : albums;
        tracks = tracks == null ? List.of() : tracks;
        folders = folders == null ? List.of() : folders;
        playlists = playlists == null ? List.of() : playlists;
        videos = videos == null ? List.of() : videos;
        images = images == null ? List.of() : images;
    }

    /** An artist or genre. */
    public record Named(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name
    ) {}

    public record Album(
        @JsonProperty("id") long id,
        @JsonProperty("title") String title,
        @JsonProperty("artistId") Long artistId,
        @JsonProperty("year") int year,
        @JsonProperty("artworkTrackId") Long artworkTrackId,
        @JsonProperty("addedTime") long addedTime
    ) {}

    public record Track(
        @JsonProperty("id") long id,
        @JsonProperty("url") String url,
        @JsonProperty("title") String title,
        @JsonProperty("albumId") Long albumId,
        @JsonProperty("artistId") Long artistId,
        @JsonProperty("genreId") Long genreId,
        @JsonProperty("tracknum") Integer tracknum,
        @JsonProperty("year") int year,
        @JsonProperty("secs") Double secs,
        @JsonProperty("contentType") String contentType,
        @JsonProperty("bitrate") Integer bitrate,
        @JsonProperty("samplerate") Integer samplerate,
        @JsonProperty("filesize") Long filesize,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("addedTime") long addedTime,
        @JsonProperty("updatedTime") long updatedTime
    ) {}

    /**
     * A music folder entry. Root entries have no parent; track entries name their track.
     */
    public record Folder(
        @JsonProperty("id") long id,
        @JsonProperty("parentId") Long parentId,
        @JsonProperty("filename") String filename,
        @JsonProperty("type") String type,
        @JsonProperty("trackId") Long trackId
    ) {}

    public record Playlist(
        @JsonProperty("id") long id,
        @JsonProperty("title") String title,
        @JsonProperty("trackIds") List<Long> trackIds
    ) {
        public Playlist {
            trackIds = trackIds == null ? List.of() : trackIds;
        }
    }

    public record Video(
        @JsonProperty("hash") String hash,
        @JsonProperty("url") String url,
        @JsonProperty("title") String title,
        @JsonProperty("album") String album,
        @JsonProperty("mimeType") String mimeType,
        @JsonProperty("secs") Double secs,
        @JsonProperty("width") Integer width,
        @JsonProperty("height") Integer height,
        @JsonProperty("filesize") Long filesize,
        @JsonProperty("mtime") long mtime,
        @JsonProperty("addedTime") long addedTime,
        @JsonProperty("updatedTime") long updatedTime
    ) {}

    public record Image(
        @JsonProperty("hash") String hash,
        @JsonProperty("url") String url,
        @JsonProperty("title") String title,
        @JsonProperty("album") String album,
        @JsonProperty("mimeType") String mimeType,
        @JsonProperty("width") Integer width,
        @JsonProperty("height") Integer height,
        @JsonProperty("filesize") Long filesize,
        @JsonProperty("originalTime") long originalTime,
        @JsonProperty("mtime") long mtime,
        @JsonProperty("addedTime") long addedTime,
        @JsonProperty("updatedTime") long updatedTime
    ) {}
}
