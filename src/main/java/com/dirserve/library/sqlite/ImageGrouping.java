/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library.sqlite;

import java.util.Arrays;
import java.util.Optional;

/**
 * Ways of grouping images into containers. Keys are derived from the image's
 * original time (UTC) or its album name.
 */
enum ImageGrouping {
    YEARS("years", "strftime('%Y', images.original_time, 'unixepoch')", null),
    MONTHS("months", "strftime('%m', images.original_time, 'unixepoch')",
        "strftime('%Y', images.original_time, 'unixepoch')"),
    DAYS("days", "strftime('%d', images.original_time, 'unixepoch')",
        "strftime('%Y-%m', images.original_time, 'unixepoch')"),
    DATES("dates", "strftime('%Y/%m/%d', images.original_time, 'unixepoch')", null),
    ALBUMS("albums", "NULLIF(images.album, '')", null);

    private final String timeline;
    private final String keyExpression;
    private final String scopeExpression;

    ImageGrouping(String timeline, String keyExpression, String scopeExpression) {
        this.timeline = timeline;
        this.keyExpression = keyExpression;
        this.scopeExpression = scopeExpression;
    }

    static Optional<ImageGrouping> forTimeline(String timeline) {
        return Arrays.stream(values())
            .filter(g -> g.timeline.equals(timeline))
            .findFirst();
    }

    String keyExpression() {
        return keyExpression;
    }

    /** Expression compared against the {@code search} parameter, or null when the grouping is unscoped. */
    String scopeExpression() {
        return scopeExpression;
    }

    String title(String scope, String key) {
        return switch (this) {
            case MONTHS, DAYS -> scope + "-" + key;
            case DATES -> key.replace('/', '-');
            default -> key;
        };
    }
}
