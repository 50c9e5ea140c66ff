/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.utils;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared ObjectMapper for reading library manifests. ObjectMapper is thread-safe
 * after configuration, so one instance serves every import.
 */
public final class JacksonConfig {

    private static final ObjectMapper MANIFEST_INSTANCE = new ObjectMapper();

    static {
        MANIFEST_INSTANCE.registerModule(new JavaTimeModule());
        // Manifests are produced by external scanners that add fields we don't use
        MANIFEST_INSTANCE.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private JacksonConfig() {}

    /** ObjectMapper tolerant of unknown manifest fields, with java.time support. */
    public static ObjectMapper manifestMapper() {
        return MANIFEST_INSTANCE;
    }
}
