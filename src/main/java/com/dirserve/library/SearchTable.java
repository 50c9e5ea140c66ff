/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library;

/**
 * Table families a Search can target. Each family has its own id column and
 * returns rows through its own browse command.
 */
public enum SearchTable {
    TRACKS("tracks", "id", LibraryCommand.TITLES),
    VIDEOS("videos", "hash", LibraryCommand.VIDEO_TITLES),
    IMAGES("images", "hash", LibraryCommand.IMAGE_TITLES);

    private final String tableName;
    private final String idColumn;
    private final LibraryCommand command;

    SearchTable(String tableName, String idColumn, LibraryCommand command) {
        this.tableName = tableName;
        this.idColumn = idColumn;
        this.command = command;
    }

    public String getTableName() {
        return tableName;
    }

    public String getIdColumn() {
        return idColumn;
    }

    public LibraryCommand getCommand() {
        return command;
    }
}
