/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.event;

import java.net.URI;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A GENA event subscription. Event keys start at 0 for the initial event and
 * increase by one per delivered event.
 */
public class Subscription {

    private final String sid;
    private final List<URI> callbacks;
    private final AtomicLong nextSequence = new AtomicLong();
    private volatile int timeoutSeconds;
    private volatile long expiresAtMillis;
    private volatile boolean initialEventSent;

    public Subscription(String sid, List<URI> callbacks, int timeoutSeconds, long nowMillis) {
        this.sid = sid;
        this.callbacks = List.copyOf(callbacks);
        renew(timeoutSeconds, nowMillis);
    }

    public String getSid() {
        return sid;
    }

    public List<URI> getCallbacks() {
        return callbacks;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAtMillis;
    }

    public final void renew(int timeoutSeconds, long nowMillis) {
        this.timeoutSeconds = timeoutSeconds;
        this.expiresAtMillis = nowMillis + timeoutSeconds * 1000L;
    }

    public boolean isInitialEventSent() {
        return initialEventSent;
    }

    void markInitialEventSent() {
        initialEventSent = true;
    }

    /** Takes the event key for the next notification. */
    public long nextSequence() {
        return nextSequence.getAndIncrement();
    }

    @Override
    public String toString() {
        return sid + " -> " + callbacks;
    }
}
