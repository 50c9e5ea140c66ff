/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

/**
 * Arguments of the Search action as received.
 */
public record SearchRequest(
    String containerId,
    String searchCriteria,
    String filter,
    long startingIndex,
    long requestedCount,
    String sortCriteria
) {}
