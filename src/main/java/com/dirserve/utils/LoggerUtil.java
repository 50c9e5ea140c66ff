/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.utils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Console logger used throughout the server.
 *
 * <p>Lines are written as {@code [timestamp][LEVEL] message}. The most recent
 * lines are also kept in memory so the health endpoint can show them.
 */
public final class LoggerUtil {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static final int HISTORY_CAPACITY = 100;

    private static final Deque<String> history = new ArrayDeque<>();
    private static volatile boolean debugEnabled = false;

    public static void log(String level, String msg) {
        String line = "[" + TS.format(LocalDateTime.now()) + "][" + level + "] " + msg;
        System.out.println(line);
        remember(line);
    }

    public static void info(String msg) { log("INFO", msg); }
    public static void warn(String msg) { log("WARN", msg); }
    public static void error(String msg) { log("ERROR", msg); }
    public static void debug(String msg) { if (debugEnabled) log("DEBUG", msg); }
    public static void debug(Supplier<String> msgSupplier) {
        if (debugEnabled) {
            log("DEBUG", msgSupplier.get());
        }
    }

    /**
     * Logs an error together with the exception class, which is usually more
     * useful than the bare message for SQL and XML failures.
     */
    public static void error(String msg, Throwable t) {
        log("ERROR", msg + ": " + t.getClass().getSimpleName() + ": " + t.getMessage());
    }

    public static void setDebugEnabled(boolean enabled) { debugEnabled = enabled; }

    /**
     * Returns up to {@code count} of the most recent lines, oldest first.
     */
    public static List<String> getRecentLogs(int count) {
        synchronized (history) {
            List<String> all = new ArrayList<>(history);
            int from = Math.max(0, all.size() - Math.max(0, count));
            return new ArrayList<>(all.subList(from, all.size()));
        }
    }

    private static void remember(String line) {
        synchronized (history) {
            history.addLast(line);
            if (history.size() > HISTORY_CAPACITY) {
                history.removeFirst();
            }
        }
    }

    private LoggerUtil() {}
}
