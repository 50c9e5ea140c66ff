/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.web;

import com.dirserve.db.DatabaseManager;
import com.dirserve.db.LibrarySchema;
import com.dirserve.library.MediaLibrary;
import com.dirserve.library.manifest.LibraryImporter;
import com.dirserve.library.sqlite.SqliteMediaLibrary;
import com.dirserve.upnp.cd.ContentDirectoryService;
import com.dirserve.upnp.cd.PathGrammar;
import com.dirserve.upnp.cd.QueryTranslator;
import com.dirserve.upnp.cd.StaticMenus;
import com.dirserve.upnp.cd.criteria.SearchCriteriaDecoder;
import com.dirserve.upnp.cd.criteria.SortCriteriaDecoder;
import com.dirserve.upnp.cd.didl.DidlRenderer;
import com.dirserve.upnp.cd.event.ContentDirectoryState;
import com.dirserve.upnp.cd.event.EventNotifier;
import com.dirserve.upnp.cd.event.GenaEventSink;
import com.dirserve.upnp.cd.event.SubscriptionRegistry;
import com.dirserve.utils.LoggerUtil;
import com.dirserve.web.api.LibraryController;
import com.dirserve.web.api.SharedErrorResponse;
import com.dirserve.web.upnp.ContentDirectoryController;
import com.dirserve.web.upnp.EventSubscriptionController;
import io.javalin.Javalin;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Properties;

/**
 * HTTP front end of the media server.
 * <p>
 * Serves the ContentDirectory SOAP control endpoint, its service description and
 * event subscriptions, plus a small JSON API for health and rescans.
 */
public class DirserveWebServer {
    private final DatabaseManager databaseManager;
    private final LibraryImporter importer;
    private final EventNotifier notifier;
    private final GenaEventSink eventSink;
    private final ContentDirectoryService contentDirectory;
    private final ContentDirectoryController contentDirectoryController;
    private final EventSubscriptionController subscriptionController;
    private final LibraryController libraryController;
    private Javalin app;

    public DirserveWebServer(Properties config, DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;

        // Initialize database schema
        try {
            LibrarySchema.initializeSchema(databaseManager);
        } catch (SQLException e) {
            LoggerUtil.error("Failed to initialize database schema: " + e.getMessage());
            throw new IllegalStateException("Database initialization failed", e);
        }

        MediaLibrary library = new SqliteMediaLibrary(databaseManager);
        this.importer = new LibraryImporter(databaseManager);

        String manifest = config.getProperty("library.manifest", "").trim();
        boolean importOnStartup = Boolean.parseBoolean(config.getProperty("library.import.on.startup", "true"));
        if (!manifest.isEmpty() && importOnStartup) {
            if (Files.isRegularFile(Path.of(manifest))) {
                importer.importFile(Path.of(manifest));
            } else {
                LoggerUtil.warn("Library manifest not found, starting with the existing library: " + manifest);
            }
        }

        // Event plumbing: the revision starts at the last scan time
        ContentDirectoryState state = new ContentDirectoryState(library.lastScanTime());
        SubscriptionRegistry registry = new SubscriptionRegistry(
            intProperty(config, "upnp.subscription.timeout.seconds", SubscriptionRegistry.DEFAULT_TIMEOUT_SECONDS));
        this.eventSink = new GenaEventSink(longProperty(config, "gena.notify.timeout.ms", 5000));
        this.notifier = new EventNotifier(state, registry, eventSink,
            longProperty(config, "upnp.event.rate.ms", EventNotifier.DEFAULT_RATE_MS));
        importer.addScanListener(notifier);

        String baseUrl = config.getProperty("http.base.url", "http://localhost:9000");
        this.contentDirectory = new ContentDirectoryService(
            library,
            state,
            new PathGrammar(),
            new QueryTranslator(intProperty(config, "browse.age.limit", QueryTranslator.DEFAULT_AGE_LIMIT)),
            new SearchCriteriaDecoder(),
            new SortCriteriaDecoder(),
            new DidlRenderer(library, baseUrl),
            new StaticMenus(config.getProperty("server.library.name", "Library")));

        this.contentDirectoryController = new ContentDirectoryController(contentDirectory);
        this.subscriptionController = new EventSubscriptionController(notifier);
        this.libraryController = new LibraryController(databaseManager, importer, notifier, manifest);
    }

    /**
     * Starts the web server on the specified port.
     *
     * @param port Port to bind the server to, 0 for any free port
     */
    public void start(int port) {
        app = Javalin.create(javalinConfig -> {
            javalinConfig.jsonMapper(new GsonJsonMapper());
        });

        configureRoutes();
        configureErrorHandlers();

        app.start(port);
        LoggerUtil.info("Dirserve Web Server started on port " + app.port());
    }

    /**
     * Stops the web server and the event scheduler. The database is owned by the caller.
     */
    public void stop() {
        if (app != null) {
            app.stop();
            LoggerUtil.info("Dirserve Web Server stopped");
        }
        notifier.close();
        try {
            eventSink.close();
        } catch (IOException e) {
            LoggerUtil.warn("Failed to close event HTTP client: " + e.getMessage());
        }
    }

    /** Port actually bound, useful after {@code start(0)}. */
    public int getPort() {
        return app.port();
    }

    public ContentDirectoryService getContentDirectory() {
        return contentDirectory;
    }

    public LibraryImporter getImporter() {
        return importer;
    }

    public EventNotifier getNotifier() {
        return notifier;
    }

    private void configureRoutes() {
        app.post("/upnp/control/ContentDirectory", contentDirectoryController::control);
        app.get("/upnp/ContentDirectory.xml", contentDirectoryController::describe);
        app.post("/upnp/event/ContentDirectory/subscribe", subscriptionController::subscribe);
        app.post("/upnp/event/ContentDirectory/unsubscribe", subscriptionController::unsubscribe);

        app.get("/api/health", libraryController::health);
        app.post("/api/library/rescan", libraryController::rescan);
    }

    /**
     * Configures error handlers for proper JSON error responses.
     */
    private void configureErrorHandlers() {
        app.exception(Exception.class, (e, ctx) -> {
            LoggerUtil.error("Unhandled exception in web request " + ctx.path(), e);
            ctx.status(500).json(SharedErrorResponse.serverError(e.getMessage()));
        });

        app.error(404, ctx -> {
            if (ctx.path().startsWith("/api/")) {
                ctx.json(SharedErrorResponse.notFound("API endpoint not found: " + ctx.path()));
            }
        });
    }

    private static int intProperty(Properties config, String key, int defaultValue) {
        String value = config.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : Integer.parseInt(value.trim());
    }

    private static long longProperty(Properties config, String key, long defaultValue) {
        String value = config.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : Long.parseLong(value.trim());
    }
}
