/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

import java.util.Optional;

/**
 * The two Browse modes.
 */
public enum BrowseFlag {
    /** Describe the object itself; exactly one node. */
    BROWSE_METADATA("BrowseMetadata"),
    /** List a page of the object's children. */
    BROWSE_DIRECT_CHILDREN("BrowseDirectChildren");

    private final String wireName;

    BrowseFlag(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<BrowseFlag> fromWireName(String value) {
        for (BrowseFlag flag : values()) {
            if (flag.wireName.equals(value)) {
                return Optional.of(flag);
            }
        }
        return Optional.empty();
    }
}
