/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.web.api;

import com.dirserve.db.DatabaseManager;
import com.dirserve.library.LibraryException;
import com.dirserve.library.manifest.LibraryImporter;
import com.dirserve.library.manifest.LibraryImporter.ImportSummary;
import com.dirserve.upnp.cd.event.EventNotifier;
import com.dirserve.utils.LoggerUtil;
import io.javalin.http.Context;

import java.nio.file.Path;
import java.util.List;

/**
 * JSON endpoints for operating the server.
 *
 * GET  /api/health
 * POST /api/library/rescan
 */
public class LibraryController {
    private static final int HEALTH_LOG_LINES = 20;

    private final DatabaseManager databaseManager;
    private final LibraryImporter importer;
    private final EventNotifier notifier;
    private final String manifestPath;

    /**
     * @param manifestPath configured library manifest, blank when rescans are not available
     */
    public LibraryController(DatabaseManager databaseManager,
                             LibraryImporter importer,
                             EventNotifier notifier,
                             String manifestPath) {
        this.databaseManager = databaseManager;
        this.importer = importer;
        this.notifier = notifier;
        this.manifestPath = manifestPath;
    }

    public void health(Context ctx) {
        ctx.json(new HealthResponse(
            "OK",
            System.currentTimeMillis(),
            notifier.getSystemUpdateId(),
            notifier.getSubscriberCount(),
            databaseManager.getStats(),
            LoggerUtil.getRecentLogs(HEALTH_LOG_LINES)));
    }

    /**
     * Re-imports the configured manifest. Listeners (the event notifier) are
     * signalled by the importer once the new library is committed.
     */
    public void rescan(Context ctx) {
        if (manifestPath == null || manifestPath.isBlank()) {
            ctx.status(409).json(SharedErrorResponse.conflict("No library.manifest configured"));
            return;
        }
        try {
            ImportSummary summary = importer.importFile(Path.of(manifestPath));
            LoggerUtil.info("Rescan complete: " + summary);
            ctx.json(summary);
        } catch (LibraryException.ManifestException e) {
            LoggerUtil.error("Rescan failed: " + e.getMessage());
            ctx.status(400).json(SharedErrorResponse.badRequest(e.getMessage()));
        }
    }

    /**
     * Response record for health check endpoint.
     */
    private record HealthResponse(
        String status,
        long timestamp,
        long systemUpdateId,
        int subscribers,
        String dbStats,
        List<String> recentLogs
    ) {}
}
