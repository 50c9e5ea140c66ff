/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.web;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonSyntaxException;
import io.javalin.json.JsonMapper;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Type;

/**
 * Javalin JSON mapper for the {@code /api} endpoints. Library titles are emitted
 * as-is, so HTML escaping is off.
 */
public class GsonJsonMapper implements JsonMapper {
    private final Gson gson;

    public GsonJsonMapper() {
        this(new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create());
    }

    public GsonJsonMapper(Gson gson) {
        this.gson = gson;
    }

    @Override
    public String toJsonString(@NotNull Object obj, @NotNull Type type) {
        return gson.toJson(obj, type);
    }

    @Override
    public <T> T fromJsonString(@NotNull String json, @NotNull Type targetType) {
        try {
            return gson.fromJson(json, targetType);
        } catch (JsonSyntaxException e) {
            throw new IllegalArgumentException("Malformed request body: " + e.getMessage(), e);
        }
    }
}
