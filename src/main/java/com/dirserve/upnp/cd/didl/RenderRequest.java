/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.didl;

import com.dirserve.upnp.cd.ObjectPath;
import com.dirserve.upnp.cd.RowTemplate;

/**
 * What the renderer needs besides the rows.
 *
 * @param template   how to render each row
 * @param describe   true for BrowseMetadata: the single row is the node {@code objectId}
 *                   itself, reported under {@code parentId}
 * @param objectId   the browsed ID; in listing mode, the parent of every rendered node
 * @param parentId   parentID reported in describe mode
 * @param folder     the browsed music folder path, for naming the tracks it lists; may be null
 * @param filter     optional properties to include
 * @param totalCap   upper bound on the reported total
 */
public record RenderRequest(
    RowTemplate template,
    boolean describe,
    String objectId,
    String parentId,
    ObjectPath folder,
    DidlFilter filter,
    int totalCap
) {

    /** Lists rows as children of {@code objectId}. */
    public static RenderRequest listing(RowTemplate template, String objectId, DidlFilter filter) {
        return new RenderRequest(template, false, objectId, objectId, null, filter, Integer.MAX_VALUE);
    }

    /** Describes {@code path} itself. */
    public static RenderRequest describing(RowTemplate template, ObjectPath path, DidlFilter filter) {
        return new RenderRequest(template, true, path.id(), path.metadataParent(), null, filter, Integer.MAX_VALUE);
    }

    public RenderRequest withFolder(ObjectPath folderPath) {
        return new RenderRequest(template, describe, objectId, parentId, folderPath, filter, totalCap);
    }

    public RenderRequest withTotalCap(int cap) {
        return new RenderRequest(template, describe, objectId, parentId, folder, filter, cap);
    }
}
