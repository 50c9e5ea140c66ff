/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.db;

import com.dirserve.utils.LoggerUtil;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Owns the HikariCP connection pool for the SQLite library database.
 *
 * The library is read by every Browse/Search request and rewritten wholesale by
 * a rescan, so the pool is sized for concurrent readers and WAL mode keeps
 * readers unblocked while an import transaction runs.
 */
public class DatabaseManager implements AutoCloseable {
    private static final int DEFAULT_POOL_SIZE = 8;

    private final HikariDataSource dataSource;
    private final String dbPath;

    public DatabaseManager(String dbPath) {
        this(dbPath, DEFAULT_POOL_SIZE);
    }

    public DatabaseManager(String dbPath, int poolSize) {
        this.dbPath = dbPath;

        createParentDirectoryIfNeeded(dbPath);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + dbPath);
        config.setPoolName("library-db");
        config.setMaximumPoolSize(poolSize > 0 ? poolSize : DEFAULT_POOL_SIZE);
        config.setConnectionTimeout(30000); // 30 seconds
        config.setIdleTimeout(600000); // 10 minutes
        config.setMaxLifetime(1800000); // 30 minutes

        // SQLite pragmas, applied by the driver on every new connection
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("foreign_keys", "true");
        config.addDataSourceProperty("temp_store", "memory");

        this.dataSource = new HikariDataSource(config);

        LoggerUtil.info("Library database pool initialized: " + dbPath);
    }

    /**
     * Borrows a connection from the pool. Callers close it to return it.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public HikariDataSource getDataSource() {
        return dataSource;
    }

    public String getDbPath() {
        return dbPath;
    }

    public boolean databaseExists() {
        File dbFile = new File(dbPath);
        return dbFile.exists() && dbFile.length() > 0;
    }

    private void createParentDirectoryIfNeeded(String dbPath) {
        Path parentDir = Paths.get(dbPath).getParent();
        if (parentDir == null) {
            return;
        }

        File dir = parentDir.toFile();
        if (!dir.exists()) {
            if (dir.mkdirs()) {
                LoggerUtil.info("Created database directory: " + parentDir);
            } else {
                LoggerUtil.warn("Failed to create database directory: " + parentDir);
            }
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            LoggerUtil.info("Library database pool closed");
        }
    }

    /**
     * Pool statistics for the health endpoint.
     */
    public String getStats() {
        if (dataSource.isClosed() || dataSource.getHikariPoolMXBean() == null) {
            return "DB Pool - closed";
        }

        return String.format("DB Pool - Active: %d, Idle: %d, Total: %d, Pending: %d",
            dataSource.getHikariPoolMXBean().getActiveConnections(),
            dataSource.getHikariPoolMXBean().getIdleConnections(),
            dataSource.getHikariPoolMXBean().getTotalConnections(),
            dataSource.getHikariPoolMXBean().getThreadsAwaitingConnection()
        );
    }
}
