/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library;

import com.dirserve.library.LibraryRows.LibraryRow;

import java.util.List;

/**
 * Rows returned by a library query.
 *
 * @param command the command that produced the rows
 * @param rows    rows inside the requested page window
 * @param count   total matching rows, ignoring the page window
 */
public record LibraryResult(LibraryCommand command, List<LibraryRow> rows, int count) {

    public LibraryResult {
        rows = List.copyOf(rows);
    }

    public String loopName() {
        return command.getLoopName();
    }

    public static LibraryResult empty(LibraryCommand command) {
        return new LibraryResult(command, List.of(), 0);
    }
}
