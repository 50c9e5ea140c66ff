/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.event;

/**
 * Process-wide ContentDirectory state: the SystemUpdateID revision and the
 * subscriber count. All reads and writes go through this object's monitor, which
 * {@link EventNotifier} also holds while it schedules broadcasts.
 */
public class ContentDirectoryState {

    private long systemUpdateId;
    private int subscriberCount;

    /**
     * @param initialRevision last library scan time, epoch seconds
     */
    public ContentDirectoryState(long initialRevision) {
        this.systemUpdateId = Math.max(0, initialRevision);
    }

    public synchronized long getSystemUpdateId() {
        return systemUpdateId;
    }

    /**
     * Moves the revision forward. A revision older than the current one is ignored
     * so the value never decreases.
     *
     * @return the revision after the update
     */
    public synchronized long updateRevision(long revision) {
        if (revision > systemUpdateId) {
            systemUpdateId = revision;
        }
        return systemUpdateId;
    }

    public synchronized int getSubscriberCount() {
        return subscriberCount;
    }

    public synchronized int incrementSubscribers() {
        return ++subscriberCount;
    }

    /** Decrements the subscriber count, never below zero. */
    public synchronized int decrementSubscribers() {
        if (subscriberCount > 0) {
            subscriberCount--;
        }
        return subscriberCount;
    }
}
