/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.event;

/**
 * Delivers one evented state variable change to one subscriber.
 */
public interface EventSink {

    /**
     * @param sequence GENA event key (SEQ header)
     */
    void deliver(Subscription subscription, long sequence, String variable, String value);
}
