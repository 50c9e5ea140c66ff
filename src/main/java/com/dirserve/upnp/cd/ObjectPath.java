/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A parsed object-ID.
 *
 * @param id    the object-ID exactly as received
 * @param mount the mount the ID belongs to
 * @param type  what the ID names
 * @param keys  keys threaded through the ID, in their raw form except
 *              {@link PathKey#IMAGE_ALBUM} which is URL-decoded
 */
public record ObjectPath(String id, Mount mount, NodeType type, Map<PathKey, String> keys) {

    public ObjectPath {
        keys = keys.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(keys));
    }

    public boolean isItem() {
        return type.isItem();
    }

    public boolean has(PathKey key) {
        return keys.containsKey(key);
    }

    /**
     * @throws IllegalStateException if the ID carries no such key
     */
    public String key(PathKey key) {
        String value = keys.get(key);
        if (value == null) {
            throw new IllegalStateException(id + " has no " + key + " key");
        }
        return value;
    }

    /** ID of a child reached through {@code key}, with an optional trailing suffix segment. */
    public String childId(String key, String suffix) {
        return suffix == null ? id + "/" + key : id + "/" + key + "/" + suffix;
    }

    /**
     * ID of a track listed inside this music folder. Track IDs end in {@code /t/<id>}
     * so they cannot be mistaken for folders: {@code /m/5/m} gives {@code /m/5/t/9}
     * and the folder root {@code /m} gives {@code /m/t/9}.
     */
    public String folderTrackId(long trackId) {
        if (type == NodeType.MOUNT_ROOT) {
            return id + "/t/" + trackId;
        }
        return id.substring(0, id.length() - 1) + "t/" + trackId;
    }

    /**
     * The parentID reported when this node is described in BrowseMetadata mode.
     * Browsing that ID lists this node again.
     */
    public String metadataParent() {
        return switch (type) {
            case MOUNT_ROOT -> mount.getMenuId();
            case ARTIST, ALBUM, GENRE, YEAR, PLAYLIST, FOLDER -> stripSegments(id, 2);
            case TRACK -> trackParent();
            case DATE -> Mount.IMAGE_DATES.getPrefix();
            case VIDEO, IMAGE, IMAGE_ALBUM, TIMELINE_YEAR, TIMELINE_MONTH, TIMELINE_DAY -> stripSegments(id, 1);
        };
    }

    private String trackParent() {
        String parent = stripSegments(id, 1);
        if (mount != Mount.MUSIC_FOLDER) {
            return parent;
        }
        // Folder tracks are listed by their folder, which ends in /m
        String folderRoot = Mount.MUSIC_FOLDER.getPrefix();
        return parent.equals(folderRoot + "/t")
            ? folderRoot
            : parent.substring(0, parent.length() - 1) + "m";
    }

    private static String stripSegments(String id, int count) {
        String result = id;
        for (int i = 0; i < count; i++) {
            result = result.substring(0, result.lastIndexOf('/'));
        }
        return result;
    }

    @Override
    public String toString() {
        return id;
    }
}
