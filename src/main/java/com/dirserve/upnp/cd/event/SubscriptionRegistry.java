/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.event;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live GENA subscriptions keyed by SID.
 */
public class SubscriptionRegistry {

    public static final int DEFAULT_TIMEOUT_SECONDS = 1800;

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final int defaultTimeoutSeconds;
    private final int maxTimeoutSeconds;

    public SubscriptionRegistry() {
        this(DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * @param defaultTimeoutSeconds timeout granted when the subscriber asks for none or for infinite
     */
    public SubscriptionRegistry(int defaultTimeoutSeconds) {
        this.defaultTimeoutSeconds = defaultTimeoutSeconds > 0 ? defaultTimeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
        this.maxTimeoutSeconds = Math.max(this.defaultTimeoutSeconds, DEFAULT_TIMEOUT_SECONDS);
    }

    public Subscription add(List<URI> callbacks, Integer requestedTimeoutSeconds, long nowMillis) {
        String sid = "uuid:" + UUID.randomUUID();
        Subscription subscription = new Subscription(sid, callbacks, grant(requestedTimeoutSeconds), nowMillis);
        subscriptions.put(sid, subscription);
        return subscription;
    }

    public Optional<Subscription> renew(String sid, Integer requestedTimeoutSeconds, long nowMillis) {
        Subscription subscription = subscriptions.get(sid);
        if (subscription == null || subscription.isExpired(nowMillis)) {
            return Optional.empty();
        }
        subscription.renew(grant(requestedTimeoutSeconds), nowMillis);
        return Optional.of(subscription);
    }

    public Optional<Subscription> remove(String sid) {
        return Optional.ofNullable(subscriptions.remove(sid));
    }

    public Optional<Subscription> get(String sid) {
        return Optional.ofNullable(subscriptions.get(sid));
    }

    /**
     * Removes and returns every subscription that has expired.
     */
    public List<Subscription> removeExpired(long nowMillis) {
        List<Subscription> expired = new ArrayList<>();
        subscriptions.values().removeIf(subscription -> {
            if (subscription.isExpired(nowMillis)) {
                expired.add(subscription);
                return true;
            }
            return false;
        });
        return expired;
    }

    public List<Subscription> active() {
        return List.copyOf(subscriptions.values());
    }

    public int size() {
        return subscriptions.size();
    }

    /**
     * Parses a GENA TIMEOUT header value ({@code Second-300}, {@code Second-infinite}).
     * Returns null when absent, infinite or malformed, meaning "use the default".
     */
    public static Integer parseTimeoutHeader(String header) {
        if (header == null) {
            return null;
        }
        String value = header.trim();
        if (!value.regionMatches(true, 0, "Second-", 0, 7)) {
            return null;
        }
        try {
            int seconds = Integer.parseInt(value.substring(7));
            return seconds > 0 ? seconds : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private int grant(Integer requested) {
        if (requested == null || requested <= 0) {
            return defaultTimeoutSeconds;
        }
        return Math.min(requested, maxTimeoutSeconds);
    }
}
