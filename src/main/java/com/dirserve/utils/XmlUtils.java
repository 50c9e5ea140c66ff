/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.utils;

import java.util.Locale;

/**
 * Small helpers for hand-built XML (SOAP envelopes, DIDL-Lite, GENA property sets).
 */
public final class XmlUtils {

    private XmlUtils() {}

    /**
     * Escapes the five XML special characters. Null becomes the empty string.
     */
    public static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }

        StringBuilder sb = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            String replacement = switch (c) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> "&quot;";
                case '\'' -> "&apos;";
                default -> null;
            };

            if (replacement == null) {
                if (sb != null) sb.append(c);
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(value.length() + 16);
                sb.append(value, 0, i);
            }
            sb.append(replacement);
        }
        return sb == null ? value : sb.toString();
    }

    /**
     * Formats a duration in seconds as {@code H:MM:SS.mmm}, the DLNA res@duration format.
     */
    public static String secsToHms(double secs) {
        if (secs < 0 || Double.isNaN(secs)) {
            secs = 0;
        }
        long totalMillis = Math.round(secs * 1000);
        long hours = totalMillis / 3_600_000;
        long minutes = (totalMillis / 60_000) % 60;
        long seconds = (totalMillis / 1000) % 60;
        long millis = totalMillis % 1000;
        return String.format(Locale.ROOT, "%d:%02d:%02d.%03d", hours, minutes, seconds, millis);
    }
}
