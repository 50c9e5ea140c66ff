/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Top-level object-ID prefixes of the virtual hierarchy and the static menu each hangs off.
 */
public enum Mount {
    ARTISTS("/a", StaticMenus.MUSIC_ID),
    ALBUMS("/l", StaticMenus.MUSIC_ID),
    GENRES("/g", StaticMenus.MUSIC_ID),
    YEARS("/y", StaticMenus.MUSIC_ID),
    NEW_MUSIC("/n", StaticMenus.MUSIC_ID),
    MUSIC_FOLDER("/m", StaticMenus.MUSIC_ID),
    PLAYLISTS("/p", StaticMenus.MUSIC_ID),
    TRACKS("/t", StaticMenus.MUSIC_ID),
    VIDEO_FOLDER("/v", StaticMenus.VIDEO_ID),
    ALL_VIDEOS("/va", StaticMenus.VIDEO_ID),
    ALL_IMAGES("/ia", StaticMenus.IMAGES_ID),
    IMAGE_ALBUMS("/il", StaticMenus.IMAGES_ID),
    IMAGE_TIMELINE("/it", StaticMenus.IMAGES_ID),
    IMAGE_DATES("/id", StaticMenus.IMAGES_ID);

    // Longest prefix first so /va wins over /v
    private static final List<Mount> BY_PREFIX_LENGTH = Arrays.stream(values())
        .sorted(Comparator.comparingInt((Mount m) -> m.prefix.length()).reversed())
        .toList();

    private final String prefix;
    private final String menuId;

    Mount(String prefix, String menuId) {
        this.prefix = prefix;
        this.menuId = menuId;
    }

    public String getPrefix() {
        return prefix;
    }

    /** Static menu container listing this mount. */
    public String getMenuId() {
        return menuId;
    }

    /**
     * Finds the mount whose prefix is the whole ID or is followed by a slash.
     */
    public static Optional<Mount> forObjectId(String objectId) {
        for (Mount mount : BY_PREFIX_LENGTH) {
            if (objectId.equals(mount.prefix) || objectId.startsWith(mount.prefix + "/")) {
                return Optional.of(mount);
            }
        }
        return Optional.empty();
    }
}
