/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

import com.dirserve.library.PageWindow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The fixed containers above the library mounts: the root, the Music, Video and
 * Pictures menus, and the mount roots they list.
 */
public class StaticMenus {

    public static final String ROOT_ID = "0";
    public static final String ROOT_PARENT_ID = "-1";
    public static final String MUSIC_ID = "/music";
    public static final String VIDEO_ID = "/video";
    public static final String IMAGES_ID = "/images";

    /**
     * A static container.
     */
    public record MenuEntry(String id, String parentId, String title, boolean searchable) {}

    /**
     * A sorted page of menu entries.
     *
     * @param total number of entries before paging
     */
    public record MenuPage(List<MenuEntry> entries, int total) {}

    private final MenuEntry root;
    private final List<MenuEntry> topLevel;
    private final List<MenuEntry> musicMenu;
    private final List<MenuEntry> videoMenu;
    private final List<MenuEntry> imageMenu;
    private final MenuEntry tracks;

    public StaticMenus(String libraryName) {
        this.root = new MenuEntry(ROOT_ID, ROOT_PARENT_ID, "Dirserve [" + libraryName + "]", true);
        this.topLevel = List.of(
            container(MUSIC_ID, ROOT_ID, "Music"),
            container(IMAGES_ID, ROOT_ID, "Pictures"),
            container(VIDEO_ID, ROOT_ID, "Video"));
        this.musicMenu = List.of(
            mountEntry(Mount.ARTISTS, "Artists"),
            mountEntry(Mount.ALBUMS, "Albums"),
            mountEntry(Mount.GENRES, "Genres"),
            mountEntry(Mount.YEARS, "Years"),
            mountEntry(Mount.NEW_MUSIC, "New Music"),
            mountEntry(Mount.MUSIC_FOLDER, "Music Folder"),
            mountEntry(Mount.PLAYLISTS, "Playlists"));
        this.videoMenu = List.of(
            mountEntry(Mount.VIDEO_FOLDER, "Video Folder"),
            mountEntry(Mount.ALL_VIDEOS, "All Videos"));
        this.imageMenu = List.of(
            mountEntry(Mount.IMAGE_ALBUMS, "Albums"),
            mountEntry(Mount.IMAGE_TIMELINE, "Year"),
            mountEntry(Mount.IMAGE_DATES, "Date"),
            mountEntry(Mount.ALL_IMAGES, "All Pictures"));
        this.tracks = mountEntry(Mount.TRACKS, "Tracks");
    }

    /**
     * Children of a menu container, or empty if the ID is not a menu.
     */
    public Optional<List<MenuEntry>> children(String objectId) {
        return switch (objectId) {
            case ROOT_ID -> Optional.of(topLevel);
            case MUSIC_ID -> Optional.of(musicMenu);
            case VIDEO_ID -> Optional.of(videoMenu);
            case IMAGES_ID -> Optional.of(imageMenu);
            default -> Optional.empty();
        };
    }

    /**
     * The static entry describing {@code objectId}: the root, a menu or a mount root.
     */
    public Optional<MenuEntry> metadata(String objectId) {
        if (ROOT_ID.equals(objectId)) {
            return Optional.of(root);
        }
        if (tracks.id().equals(objectId)) {
            return Optional.of(tracks);
        }
        List<MenuEntry> all = new ArrayList<>(topLevel);
        all.addAll(musicMenu);
        all.addAll(videoMenu);
        all.addAll(imageMenu);
        return all.stream().filter(e -> e.id().equals(objectId)).findFirst();
    }

    /**
     * Sorts and pages menu entries. Only {@code dc:title} can be sorted on;
     * any other criteria keep menu order.
     */
    public static MenuPage page(List<MenuEntry> entries, String sort, PageWindow window) {
        List<MenuEntry> sorted = new ArrayList<>(entries);
        String criteria = sort == null ? "" : sort.trim();
        if (criteria.startsWith("+dc:title")) {
            sorted.sort(Comparator.comparing(MenuEntry::title));
        } else if (criteria.startsWith("-dc:title")) {
            sorted.sort(Comparator.comparing(MenuEntry::title).reversed());
        }

        int from = Math.min(window.start(), sorted.size());
        int to = from + window.countWithin(sorted.size());
        return new MenuPage(List.copyOf(sorted.subList(from, to)), sorted.size());
    }

    private static MenuEntry container(String id, String parentId, String title) {
        return new MenuEntry(id, parentId, title, false);
    }

    private static MenuEntry mountEntry(Mount mount, String title) {
        return container(mount.getPrefix(), mount.getMenuId(), title);
    }
}
