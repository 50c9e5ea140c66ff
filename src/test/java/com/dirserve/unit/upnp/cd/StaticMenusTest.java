/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.unit.upnp.cd;

import com.dirserve.library.PageWindow;
import com.dirserve.upnp.cd.StaticMenus;
import com.dirserve.upnp.cd.StaticMenus.MenuEntry;
import com.dirserve.upnp.cd.StaticMenus.MenuPage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StaticMenus")
class StaticMenusTest {

    private final StaticMenus menus = new StaticMenus("Home");

    @Test
    @DisplayName("should describe a searchable root named after the library")
    void shouldDescribeRoot() {
        MenuEntry root = menus.metadata(StaticMenus.ROOT_ID).orElseThrow();

        assertEquals("Dirserve [Home]", root.title());
        assertEquals(StaticMenus.ROOT_PARENT_ID, root.parentId());
        assertTrue(root.searchable());
    }

    @Test
    @DisplayName("should list the three media menus under the root")
    void shouldListTopLevel() {
        List<MenuEntry> children = menus.children(StaticMenus.ROOT_ID).orElseThrow();

        assertEquals(List.of("Music", "Pictures", "Video"), children.stream().map(MenuEntry::title).toList());
        assertTrue(children.stream().allMatch(e -> e.parentId().equals(StaticMenus.ROOT_ID)));
    }

    @Test
    @DisplayName("should list the music mounts")
    void shouldListMusicMounts() {
        List<MenuEntry> children = menus.children(StaticMenus.MUSIC_ID).orElseThrow();

        assertEquals(List.of("/a", "/l", "/g", "/y", "/n", "/m", "/p"),
            children.stream().map(MenuEntry::id).toList());
        assertTrue(children.stream().allMatch(e -> e.parentId().equals(StaticMenus.MUSIC_ID)));
    }

    @Test
    @DisplayName("should describe mount roots including the unlisted track mount")
    void shouldDescribeMountRoots() {
        assertEquals("/images", menus.metadata("/it").orElseThrow().parentId());
        assertEquals("Tracks", menus.metadata("/t").orElseThrow().title());
        assertTrue(menus.metadata("/x").isEmpty());
        assertTrue(menus.children("/a").isEmpty());
        assertTrue(menus.children(StaticMenus.VIDEO_ID).isPresent());
    }

    @Test
    @DisplayName("should sort by title and page")
    void shouldSortAndPage() {
        List<MenuEntry> images = menus.children(StaticMenus.IMAGES_ID).orElseThrow();

        MenuPage descending = StaticMenus.page(images, "-dc:title", PageWindow.of(1, 2));
        assertEquals(4, descending.total());
        assertEquals(List.of("Date", "Albums"), descending.entries().stream().map(MenuEntry::title).toList());

        MenuPage unsorted = StaticMenus.page(images, "+upnp:class", PageWindow.of(0, 0));
        assertEquals(images, unsorted.entries());

        assertTrue(StaticMenus.page(images, "", PageWindow.of(10, 5)).entries().isEmpty());
    }
}
