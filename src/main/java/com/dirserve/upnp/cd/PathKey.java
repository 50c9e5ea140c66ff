/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

/**
 * Keys an object-ID can carry. An ID holds at most one value per key; for nested
 * music folders the innermost folder wins.
 */
public enum PathKey {
    ARTIST,
    ALBUM,
    GENRE,
    YEAR,
    TRACK,
    FOLDER,
    PLAYLIST,
    HASH,
    /** Decoded image album name. */
    IMAGE_ALBUM,
    MONTH,
    DAY
}
