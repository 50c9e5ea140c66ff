/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library;

/**
 * Base exception for library query and import failures.
 */
public class LibraryException extends RuntimeException {

    public LibraryException(String message) {
        super(message);
    }

    public LibraryException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a query names a command/parameter combination the library cannot run.
     */
    public static class UnsupportedQueryException extends LibraryException {
        public UnsupportedQueryException(LibraryQuery query) {
            super("Unsupported library query: " + query);
        }
    }

    /**
     * Thrown when the library manifest cannot be read or is inconsistent.
     */
    public static class ManifestException extends LibraryException {
        public ManifestException(String message, Throwable cause) {
            super("Library manifest import failed: " + message, cause);
        }

        public ManifestException(String message) {
            super("Library manifest import failed: " + message);
        }
    }
}
