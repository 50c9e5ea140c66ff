/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.library;

/**
 * Notified after a library rescan has been committed.
 */
@FunctionalInterface
public interface ScanListener {

    /**
     * @param scanTime completion time of the scan, epoch seconds
     */
    void rescanCompleted(long scanTime);
}
