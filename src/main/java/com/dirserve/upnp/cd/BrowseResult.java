/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

/**
 * Output arguments shared by Browse and Search.
 *
 * @param result         DIDL-Lite document, empty when nothing matched
 * @param numberReturned nodes in {@code result}
 * @param totalMatches   matching nodes ignoring paging
 * @param updateId       SystemUpdateID at the time of the response
 */
public record BrowseResult(String result, int numberReturned, int totalMatches, long updateId) {}
