/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

/**
 * Arguments of the Browse action as received.
 */
public record BrowseRequest(
    String objectId,
    String browseFlag,
    String filter,
    long startingIndex,
    long requestedCount,
    String sortCriteria
) {}
