/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.criteria;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decoded sort criteria.
 *
 * @param orderSql comma separated SQL order terms, empty when nothing could be mapped
 * @param tags     joined data the order terms need
 */
public record SortClause(String orderSql, Set<Character> tags) {

    public SortClause {
        tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    public boolean isEmpty() {
        return orderSql.isEmpty();
    }
}
