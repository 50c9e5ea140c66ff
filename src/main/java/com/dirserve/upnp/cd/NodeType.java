/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

/**
 * What a parsed object-ID names.
 */
public enum NodeType {
    /** The mount itself, e.g. {@code /a}. */
    MOUNT_ROOT(false),
    ARTIST(false),
    ALBUM(false),
    GENRE(false),
    YEAR(false),
    FOLDER(false),
    PLAYLIST(false),
    IMAGE_ALBUM(false),
    TIMELINE_YEAR(false),
    TIMELINE_MONTH(false),
    TIMELINE_DAY(false),
    DATE(false),
    TRACK(true),
    VIDEO(true),
    IMAGE(true);

    private final boolean item;

    NodeType(boolean item) {
        this.item = item;
    }

    public boolean isItem() {
        return item;
    }
}
