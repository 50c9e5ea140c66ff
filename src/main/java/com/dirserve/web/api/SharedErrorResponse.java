/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.web.api;

/**
 * Error body returned by the JSON endpoints.
 */
public record SharedErrorResponse(String error, String message) {

    public static SharedErrorResponse badRequest(String message) {
        return new SharedErrorResponse("Bad request", message);
    }

    public static SharedErrorResponse notFound(String message) {
        return new SharedErrorResponse("Not found", message);
    }

    public static SharedErrorResponse conflict(String message) {
        return new SharedErrorResponse("Conflict", message);
    }

    public static SharedErrorResponse serverError(String message) {
        return new SharedErrorResponse("Server error", message);
    }
}
