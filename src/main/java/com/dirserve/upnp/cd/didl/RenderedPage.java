/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.didl;

/**
 * A rendered Browse/Search result.
 *
 * @param xml   DIDL-Lite document, or the empty string when no node was rendered
 * @param count number of nodes in {@code xml}
 * @param total number of matching nodes ignoring the page window
 */
public record RenderedPage(String xml, int count, int total) {

    public static final RenderedPage EMPTY = new RenderedPage("", 0, 0);
}
