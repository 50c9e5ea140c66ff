/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.web.upnp;

import com.dirserve.upnp.cd.event.EventNotifier;
import com.dirserve.upnp.cd.event.Subscription;
import com.dirserve.upnp.cd.event.SubscriptionRegistry;
import com.dirserve.utils.LoggerUtil;
import io.javalin.http.Context;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GENA-style event subscription for the ContentDirectory service.
 *
 * POST /upnp/event/ContentDirectory/subscribe    (CALLBACK + NT, or SID to renew; optional TIMEOUT)
 * POST /upnp/event/ContentDirectory/unsubscribe  (SID)
 *
 * <p>The headers and responses follow GENA, but the verbs do not: Javalin routes only
 * the standard HTTP methods, so these routes take POST where GENA uses SUBSCRIBE and
 * UNSUBSCRIBE. Standard control points cannot subscribe here without a proxy that
 * rewrites the method.
 */
public class EventSubscriptionController {

    private static final Pattern CALLBACK_URL = Pattern.compile("<([^>]+)>");
    private static final String EVENT_NT = "upnp:event";

    private final EventNotifier notifier;

    public EventSubscriptionController(EventNotifier notifier) {
        this.notifier = notifier;
    }

    public void subscribe(Context ctx) {
        String sid = ctx.header("SID");
        String callback = ctx.header("CALLBACK");
        Integer timeout = SubscriptionRegistry.parseTimeoutHeader(ctx.header("TIMEOUT"));

        if (sid != null && !sid.isBlank()) {
            if (callback != null || ctx.header("NT") != null) {
                ctx.status(400).result("SID cannot be combined with CALLBACK or NT");
                return;
            }
            Optional<Subscription> renewed = notifier.renew(sid.trim(), timeout);
            if (renewed.isEmpty()) {
                ctx.status(412).result("Unknown SID");
                return;
            }
            accepted(ctx, renewed.get());
            return;
        }

        String nt = ctx.header("NT");
        if (nt != null && !EVENT_NT.equals(nt.trim())) {
            ctx.status(412).result("NT must be " + EVENT_NT);
            return;
        }
        List<URI> callbacks = parseCallbacks(callback);
        if (callbacks.isEmpty()) {
            ctx.status(412).result("Missing or invalid CALLBACK");
            return;
        }

        Subscription subscription = notifier.subscribe(callbacks, timeout);
        accepted(ctx, subscription);
    }

    public void unsubscribe(Context ctx) {
        String sid = ctx.header("SID");
        if (sid == null || sid.isBlank()) {
            ctx.status(412).result("Missing SID");
            return;
        }
        if (!notifier.unsubscribe(sid.trim())) {
            ctx.status(412).result("Unknown SID");
            return;
        }
        ctx.status(200);
    }

    private static void accepted(Context ctx, Subscription subscription) {
        ctx.status(200)
            .header("SID", subscription.getSid())
            .header("TIMEOUT", "Second-" + subscription.getTimeoutSeconds());
    }

    /**
     * Parses a CALLBACK header of one or more {@code <http://...>} URLs.
     * Non-HTTP and malformed URLs are skipped.
     */
    static List<URI> parseCallbacks(String header) {
        List<URI> callbacks = new ArrayList<>();
        if (header == null) {
            return callbacks;
        }
        Matcher matcher = CALLBACK_URL.matcher(header);
        while (matcher.find()) {
            String url = matcher.group(1).trim();
            try {
                URI uri = URI.create(url);
                if ("http".equalsIgnoreCase(uri.getScheme()) && uri.getHost() != null) {
                    callbacks.add(uri);
                } else {
                    LoggerUtil.warn("Ignoring non-HTTP event callback: " + url);
                }
            } catch (IllegalArgumentException e) {
                LoggerUtil.warn("Ignoring malformed event callback: " + url);
            }
        }
        return callbacks;
    }
}
