/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.event;

import com.dirserve.utils.LoggerUtil;
import com.dirserve.utils.XmlUtils;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * Sends GENA {@code NOTIFY} requests with a {@code propertyset} body. Each callback
 * URL of the subscription is tried in order until one accepts the event.
 * Failures are logged and otherwise ignored.
 */
public class GenaEventSink implements EventSink, AutoCloseable {

    private static final ContentType TEXT_XML = ContentType.create("text/xml", StandardCharsets.UTF_8);

    private final CloseableHttpClient httpClient;
    private final long timeoutMs;

    public GenaEventSink(long timeoutMs) {
        this(HttpClients.createDefault(), timeoutMs);
    }

    public GenaEventSink(CloseableHttpClient httpClient, long timeoutMs) {
        this.httpClient = httpClient;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public void deliver(Subscription subscription, long sequence, String variable, String value) {
        String body = propertySet(variable, value);

        for (URI callback : subscription.getCallbacks()) {
            HttpUriRequestBase notify = new HttpUriRequestBase("NOTIFY", callback);
            notify.setConfig(RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(timeoutMs))
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(timeoutMs))
                .build());
            notify.setHeader("NT", "upnp:event");
            notify.setHeader("NTS", "upnp:propchange");
            notify.setHeader("SID", subscription.getSid());
            notify.setHeader("SEQ", String.valueOf(sequence));
            notify.setEntity(new StringEntity(body, TEXT_XML));

            try {
                int status = httpClient.execute(notify, response -> {
                    EntityUtils.consume(response.getEntity());
                    return response.getCode();
                });
                if (status >= 200 && status < 300) {
                    LoggerUtil.debug(() -> "[GENA] " + variable + "=" + value + " SEQ " + sequence + " -> " + callback);
                    return;
                }
                LoggerUtil.warn("[GENA] NOTIFY to " + callback + " answered HTTP " + status);
            } catch (IOException e) {
                LoggerUtil.warn("[GENA] NOTIFY to " + callback + " failed: " + e.getMessage());
            }
        }
    }

    static String propertySet(String variable, String value) {
        return "<?xml version=\"1.0\" encoding=\"utf-8\"?>"
            + "<e:propertyset xmlns:e=\"urn:schemas-upnp-org:event-1-0\">"
            + "<e:property><" + variable + ">" + XmlUtils.escape(value) + "</" + variable + "></e:property>"
            + "</e:propertyset>";
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
