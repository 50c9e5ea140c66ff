/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.didl;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The Browse/Search Filter argument: {@code *} for every optional property, otherwise
 * a comma separated list of the optional properties to include
 * ({@code dc:creator,upnp:albumArtURI,res@duration}). Required properties are
 * always rendered.
 */
public final class DidlFilter {

    public static final DidlFilter ALL = new DidlFilter(true, Set.of());
    public static final DidlFilter NONE = new DidlFilter(false, Set.of());

    private final boolean all;
    private final Set<String> properties;

    private DidlFilter(boolean all, Set<String> properties) {
        this.all = all;
        this.properties = properties;
    }

    public static DidlFilter parse(String filter) {
        if (filter == null || filter.isBlank()) {
            return NONE;
        }
        Set<String> properties = Arrays.stream(filter.split(","))
            .map(String::trim)
            .filter(p -> !p.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
        return properties.contains("*") ? ALL : new DidlFilter(false, properties);
    }

    public boolean includes(String property) {
        return all || properties.contains(property);
    }

    @Override
    public String toString() {
        return all ? "*" : String.join(",", properties);
    }
}
