/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

/**
 * Thrown when an object-ID does not match the grammar of any mount.
 */
public class InvalidPathException extends Exception {

    private final String objectId;

    public InvalidPathException(String objectId, String reason) {
        super("Invalid object ID '" + objectId + "': " + reason);
        this.objectId = objectId;
    }

    public String getObjectId() {
        return objectId;
    }
}
