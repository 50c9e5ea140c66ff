/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.web.upnp;

import com.dirserve.upnp.cd.BrowseRequest;
import com.dirserve.upnp.cd.BrowseResult;
import com.dirserve.upnp.cd.ContentDirectoryService;
import com.dirserve.upnp.cd.SearchRequest;
import com.dirserve.upnp.cd.UpnpFault;
import com.dirserve.utils.LoggerUtil;
import com.dirserve.web.upnp.SoapEnvelope.SoapAction;
import io.javalin.http.Context;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SOAP control endpoint and service description of the ContentDirectory service.
 *
 * POST /upnp/control/ContentDirectory
 * GET  /upnp/ContentDirectory.xml
 */
public class ContentDirectoryController {

    public static final String SERVICE_TYPE = "urn:schemas-upnp-org:service:ContentDirectory:1";
    private static final String XML_CONTENT_TYPE = "text/xml; charset=\"utf-8\"";
    private static final String SCPD_RESOURCE = "/upnp/ContentDirectory.xml";

    private final ContentDirectoryService service;
    private final String scpd;

    public ContentDirectoryController(ContentDirectoryService service) {
        this.service = service;
        this.scpd = loadScpd();
    }

    /**
     * Dispatches one control request. Faults are answered with HTTP 500 and a
     * UPnPError body.
     */
    public void control(Context ctx) {
        String actionName = "?";
        try {
            SoapAction action = SoapEnvelope.parse(ctx.header("SOAPACTION"), ctx.body());
            actionName = action.name();
            String response = SoapEnvelope.response(SERVICE_TYPE, action.name(), invoke(action));
            ctx.status(200).contentType(XML_CONTENT_TYPE).result(response);
        } catch (UpnpFault fault) {
            LoggerUtil.warn("[ContentDirectory] " + actionName + " fault " + fault.getCode() + ": " + fault.getDescription());
            ctx.status(500).contentType(XML_CONTENT_TYPE).result(SoapEnvelope.fault(fault));
        }
    }

    public void describe(Context ctx) {
        ctx.contentType(XML_CONTENT_TYPE).result(scpd);
    }

    Map<String, Object> invoke(SoapAction action) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        switch (action.name()) {
            case "GetSearchCapabilities" -> outputs.put("SearchCaps", service.getSearchCapabilities());
            case "GetSortCapabilities" -> outputs.put("SortCaps", service.getSortCapabilities());
            case "GetSystemUpdateID" -> outputs.put("Id", service.getSystemUpdateId());
            case "Browse" -> putResult(outputs, service.browse(new BrowseRequest(
                action.argument("ObjectID"),
                action.argument("BrowseFlag"),
                action.argument("Filter"),
                action.unsignedArgument("StartingIndex"),
                action.unsignedArgument("RequestedCount"),
                action.argument("SortCriteria"))));
            case "Search" -> putResult(outputs, service.search(new SearchRequest(
                action.argument("ContainerID"),
                action.argument("SearchCriteria"),
                action.argument("Filter"),
                action.unsignedArgument("StartingIndex"),
                action.unsignedArgument("RequestedCount"),
                action.argument("SortCriteria"))));
            default -> throw UpnpFault.invalidAction(action.name());
        }
        return outputs;
    }

    private static void putResult(Map<String, Object> outputs, BrowseResult result) {
        outputs.put("Result", result.result());
        outputs.put("NumberReturned", result.numberReturned());
        outputs.put("TotalMatches", result.totalMatches());
        outputs.put("UpdateID", result.updateId());
    }

    private static String loadScpd() {
        try (InputStream in = ContentDirectoryController.class.getResourceAsStream(SCPD_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException(SCPD_RESOURCE + " not found in classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + SCPD_RESOURCE, e);
        }
    }
}
