/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.event;

import com.dirserve.library.ScanListener;
import com.dirserve.utils.LoggerUtil;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Rate-limited SystemUpdateID eventing.
 *
 * <p>A rescan completion updates the revision and, when anyone is subscribed,
 * (re)schedules a single broadcast at {@code max(burstStart, lastBroadcast) + rate},
 * where {@code burstStart} is the first completion since the previous broadcast.
 * A burst of completions therefore yields one broadcast, sent no sooner than
 * {@code rate} after the burst began or after the previous broadcast. New
 * subscribers get the current revision right away, outside the rate limit, and
 * join broadcasts only once that initial event (key 0) has been sent.
 *
 * <p>Event keys are taken under the state lock and every delivery runs on the
 * scheduler, so a single-threaded scheduler delivers each subscriber's events in
 * key order.
 */
public class EventNotifier implements ScanListener, AutoCloseable {

    public static final String SYSTEM_UPDATE_ID = "SystemUpdateID";
    public static final long DEFAULT_RATE_MS = 200;

    private final ContentDirectoryState state;
    private final SubscriptionRegistry registry;
    private final EventSink sink;
    private final long rateMs;
    private final ScheduledExecutorService scheduler;
    private final LongSupplier clock;
    private final boolean ownsScheduler;

    // Guarded by state
    private ScheduledFuture<?> pending;
    private long burstStartMs = -1;
    private long lastBroadcastMs;

    public EventNotifier(ContentDirectoryState state, SubscriptionRegistry registry, EventSink sink, long rateMs) {
        this(state, registry, sink, rateMs, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ContentDirectoryEvents");
            t.setDaemon(true);
            return t;
        }), System::currentTimeMillis, true);
    }

    /**
     * @param scheduler runs broadcasts and initial events, one at a time
     * @param clock     current time in milliseconds
     */
    public EventNotifier(ContentDirectoryState state, SubscriptionRegistry registry, EventSink sink, long rateMs,
                         ScheduledExecutorService scheduler, LongSupplier clock) {
        this(state, registry, sink, rateMs, scheduler, clock, false);
    }

    private EventNotifier(ContentDirectoryState state, SubscriptionRegistry registry, EventSink sink, long rateMs,
                          ScheduledExecutorService scheduler, LongSupplier clock, boolean ownsScheduler) {
        this.state = state;
        this.registry = registry;
        this.sink = sink;
        this.rateMs = rateMs > 0 ? rateMs : DEFAULT_RATE_MS;
        this.scheduler = scheduler;
        this.clock = clock;
        this.ownsScheduler = ownsScheduler;
    }

    @Override
    public void rescanCompleted(long scanTime) {
        synchronized (state) {
            long revision = state.updateRevision(scanTime);
            LoggerUtil.info("Library rescan completed, SystemUpdateID " + revision);

            if (state.getSubscriberCount() == 0) {
                return;
            }

            if (pending != null) {
                pending.cancel(false);
            }

            long now = clock.getAsLong();
            if (burstStartMs < 0) {
                burstStartMs = now;
            }
            long sendAt = Math.max(burstStartMs, lastBroadcastMs) + rateMs;
            long delay = Math.max(0, sendAt - now);
            pending = scheduler.schedule(this::broadcast, delay, TimeUnit.MILLISECONDS);
            LoggerUtil.debug(() -> "[EventNotifier] Broadcast scheduled in " + delay + "ms");
        }
    }

    /**
     * Registers a subscriber and sends it the current revision.
     */
    public Subscription subscribe(List<URI> callbacks, Integer requestedTimeoutSeconds) {
        Subscription subscription;
        synchronized (state) {
            long now = clock.getAsLong();
            reapExpired(now);
            subscription = registry.add(callbacks, requestedTimeoutSeconds, now);
            state.incrementSubscribers();
        }
        LoggerUtil.info("Event subscription " + subscription.getSid() + " for " + callbacks
            + " (" + subscription.getTimeoutSeconds() + "s)");

        scheduler.execute(() -> sendInitialEvent(subscription));
        return subscription;
    }

    public Optional<Subscription> renew(String sid, Integer requestedTimeoutSeconds) {
        synchronized (state) {
            long now = clock.getAsLong();
            reapExpired(now);
            return registry.renew(sid, requestedTimeoutSeconds, now);
        }
    }

    public boolean unsubscribe(String sid) {
        synchronized (state) {
            Optional<Subscription> removed = registry.remove(sid);
            if (removed.isEmpty()) {
                return false;
            }
            state.decrementSubscribers();
        }
        LoggerUtil.info("Event subscription " + sid + " cancelled");
        return true;
    }

    public long getSystemUpdateId() {
        return state.getSystemUpdateId();
    }

    public int getSubscriberCount() {
        return state.getSubscriberCount();
    }

    /** Sends the current revision to every live subscriber. */
    void broadcast() {
        Map<Subscription, Long> targets = new LinkedHashMap<>();
        long revision;
        synchronized (state) {
            pending = null;
            burstStartMs = -1;
            long now = clock.getAsLong();
            lastBroadcastMs = now;

            reapExpired(now);
            for (Subscription subscription : registry.active()) {
                if (subscription.isInitialEventSent()) {
                    targets.put(subscription, subscription.nextSequence());
                }
            }
            revision = state.getSystemUpdateId();
        }

        LoggerUtil.debug(() -> "[EventNotifier] Broadcasting SystemUpdateID " + revision + " to "
            + targets.size() + " subscriber(s)");
        targets.forEach((subscription, sequence) -> send(subscription, sequence, revision));
    }

    private void sendInitialEvent(Subscription subscription) {
        long sequence;
        long revision;
        synchronized (state) {
            if (registry.get(subscription.getSid()).isEmpty()) {
                // Cancelled or expired before the initial event went out
                return;
            }
            sequence = subscription.nextSequence();
            revision = state.getSystemUpdateId();
            subscription.markInitialEventSent();
        }
        send(subscription, sequence, revision);
    }

    // Caller holds the state lock
    private void reapExpired(long now) {
        for (Subscription expired : registry.removeExpired(now)) {
            state.decrementSubscribers();
            LoggerUtil.info("Event subscription " + expired.getSid() + " expired");
        }
    }

    private void send(Subscription subscription, long sequence, long revision) {
        try {
            sink.deliver(subscription, sequence, SYSTEM_UPDATE_ID, String.valueOf(revision));
        } catch (RuntimeException e) {
            LoggerUtil.error("Event delivery to " + subscription.getSid() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        synchronized (state) {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        if (ownsScheduler) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
