/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve;

import com.dirserve.db.DatabaseManager;
import com.dirserve.utils.LoggerUtil;
import com.dirserve.web.DirserveWebServer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * Launcher for the Dirserve media server.
 *
 * Loads configuration, opens the library database and starts the HTTP front end
 * serving the UPnP ContentDirectory.
 */
public class DirserveApplication {

    private static DatabaseManager databaseManager;
    private static DirserveWebServer webServer;
    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public static void main(String[] args) {
        try {
            Properties config = loadConfiguration();
            LoggerUtil.setDebugEnabled(Boolean.parseBoolean(config.getProperty("log.debug", "false")));

            String dbPath = config.getProperty("db.path");
            databaseManager = new DatabaseManager(dbPath);
            LoggerUtil.info("Database initialized: " + dbPath);

            int webPort = Integer.parseInt(config.getProperty("web.port", "9000").trim());
            webServer = new DirserveWebServer(config, databaseManager);
            webServer.start(webPort);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LoggerUtil.info("Shutting down Dirserve...");
                shutdown();
            }));

            LoggerUtil.info("========================================");
            LoggerUtil.info("Dirserve started: " + config.getProperty("http.base.url")
                + "/upnp/ContentDirectory.xml");
            LoggerUtil.info("========================================");

            shutdownLatch.await();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LoggerUtil.error("Failed to start Dirserve: " + e.getMessage(), e);
            shutdown();
            System.exit(1);
        }
    }

    /**
     * Loads configuration from application.properties.
     */
    static Properties loadConfiguration() throws IOException {
        Properties config = new Properties();

        // First, load defaults from classpath resource
        try (InputStream inputStream = DirserveApplication.class.getClassLoader()
                .getResourceAsStream("application.properties")) {

            if (inputStream == null) {
                throw new IOException("application.properties not found in classpath");
            }

            config.load(inputStream);
            LoggerUtil.info("Loaded classpath configuration as defaults");
        }

        // Then, override with an external file next to the working directory
        Path externalConfigPath = Paths.get("config", "application.properties");

        if (Files.exists(externalConfigPath)) {
            LoggerUtil.info("Loading configuration overrides from external file: " + externalConfigPath.toAbsolutePath());
            try (InputStream inputStream = Files.newInputStream(externalConfigPath)) {
                Properties externalConfig = new Properties();
                externalConfig.load(inputStream);
                config.putAll(externalConfig);

                LoggerUtil.info("Loaded external configuration overrides (" + externalConfig.size() + " properties)");
            } catch (IOException e) {
                LoggerUtil.warn("Failed to load external configuration overrides: " + e.getMessage());
            }
        } else {
            LoggerUtil.info("No external configuration file found, using classpath defaults only");
        }

        validateConfiguration(config);

        return config;
    }

    static void validateConfiguration(Properties config) {
        String dbPath = config.getProperty("db.path");
        if (dbPath == null || dbPath.trim().isEmpty()) {
            config.setProperty("db.path", "db/dirserve.db");
            LoggerUtil.warn("No db.path configured, using default: db/dirserve.db");
        }

        String baseUrl = config.getProperty("http.base.url");
        if (baseUrl == null || baseUrl.trim().isEmpty()) {
            baseUrl = "http://localhost:" + config.getProperty("web.port", "9000").trim();
            config.setProperty("http.base.url", baseUrl);
            LoggerUtil.warn("No http.base.url configured, using default: " + baseUrl);
        } else if (baseUrl.endsWith("/")) {
            config.setProperty("http.base.url", baseUrl.substring(0, baseUrl.length() - 1));
        }

        String[] positiveKeys = {"web.port", "browse.age.limit", "upnp.event.rate.ms",
            "upnp.subscription.timeout.seconds", "gena.notify.timeout.ms"};
        for (String key : positiveKeys) {
            String value = config.getProperty(key);
            if (value == null) {
                continue;
            }
            try {
                if (Long.parseLong(value.trim()) <= 0) {
                    throw new IllegalArgumentException(key + " must be positive, got " + value);
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number, got " + value, e);
            }
        }

        String manifest = config.getProperty("library.manifest", "").trim();
        if (!manifest.isEmpty() && !Files.isRegularFile(Paths.get(manifest))) {
            LoggerUtil.warn("library.manifest does not exist yet: " + manifest);
        }

        LoggerUtil.info("Configuration validation passed");
    }

    private static void shutdown() {
        try {
            if (webServer != null) {
                LoggerUtil.info("Stopping Web Server...");
                webServer.stop();
            }

            if (databaseManager != null) {
                databaseManager.close();
                LoggerUtil.info("Database connections closed");
            }

            LoggerUtil.info("Dirserve shutdown complete");
        } catch (RuntimeException e) {
            LoggerUtil.error("Error during shutdown: " + e.getMessage(), e);
        } finally {
            shutdownLatch.countDown();
        }
    }
}
