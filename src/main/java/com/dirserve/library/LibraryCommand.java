/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library;

/**
 * Named queries understood by a {@link MediaLibrary}, with the result loop each one fills.
 */
public enum LibraryCommand {
    ARTISTS("artists", "artists_loop"),
    ALBUMS("albums", "albums_loop"),
    GENRES("genres", "genres_loop"),
    YEARS("years", "years_loop"),
    MUSICFOLDER("musicfolder", "folder_loop"),
    TITLES("titles", "titles_loop"),
    PLAYLISTS("playlists", "playlists_loop"),
    PLAYLIST_TRACKS("playlists tracks", "playlisttracks_loop"),
    VIDEO_TITLES("video_titles", "videos_loop"),
    IMAGE_TITLES("image_titles", "images_loop");

    private final String commandName;
    private final String loopName;

    LibraryCommand(String commandName, String loopName) {
        this.commandName = commandName;
        this.loopName = loopName;
    }

    public String getCommandName() {
        return commandName;
    }

    public String getLoopName() {
        return loopName;
    }
}
