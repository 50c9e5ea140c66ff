/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

/**
 * How backend rows of one kind are rendered: the DIDL-Lite class and, for
 * containers, the suffix segment appended to child IDs in BrowseDirectChildren mode.
 */
public enum RowTemplate {
    ARTIST("object.container.person.musicArtist", "l"),
    ALBUM("object.container.album.musicAlbum", "t"),
    GENRE("object.container.genre.musicGenre", "a"),
    YEAR("object.container", "l"),
    FOLDER("object.container.storageFolder", "m"),
    PLAYLIST("object.container.playlistContainer", "t"),
    IMAGE_GROUP("object.container", null),
    TRACK("object.item.audioItem.musicTrack", null),
    VIDEO("object.item.videoItem", null),
    IMAGE("object.item.imageItem.photo", null);

    private final String upnpClass;
    private final String childSuffix;

    RowTemplate(String upnpClass, String childSuffix) {
        this.upnpClass = upnpClass;
        this.childSuffix = childSuffix;
    }

    public String getUpnpClass() {
        return upnpClass;
    }

    /** Segment following the row key in child IDs, or null when the key ends the ID. */
    public String getChildSuffix() {
        return childSuffix;
    }
}
