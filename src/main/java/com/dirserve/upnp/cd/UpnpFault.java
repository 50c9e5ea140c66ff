/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

/**
 * A ContentDirectory action failure, returned to the control point as a SOAP fault
 * carrying a UPnPError code.
 */
public class UpnpFault extends RuntimeException {

    public static final int NO_SUCH_OBJECT = 701;
    public static final int UNSUPPORTED_CRITERIA = 708;
    public static final int CANNOT_PROCESS = 720;
    public static final int INVALID_ACTION = 401;
    public static final int INVALID_ARGS = 402;

    private final int code;

    public UpnpFault(int code, String description) {
        super(description);
        this.code = code;
    }

    public UpnpFault(int code, String description, Throwable cause) {
        super(description, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public String getDescription() {
        return getMessage();
    }

    public static UpnpFault noSuchObject() {
        return new UpnpFault(NO_SUCH_OBJECT, "No such object");
    }

    public static UpnpFault unsupportedCriteria(String detail) {
        return new UpnpFault(UNSUPPORTED_CRITERIA, "Unsupported or invalid search criteria (" + detail + ")");
    }

    public static UpnpFault unsupportedSort() {
        return new UpnpFault(UNSUPPORTED_CRITERIA, "Unsupported or invalid sort criteria");
    }

    public static UpnpFault cannotProcess(String detail, Throwable cause) {
        return new UpnpFault(CANNOT_PROCESS, "Cannot process the request (" + detail + ")", cause);
    }

    public static UpnpFault invalidAction(String action) {
        return new UpnpFault(INVALID_ACTION, "Invalid Action: " + action);
    }

    public static UpnpFault invalidArgs(String detail) {
        return new UpnpFault(INVALID_ARGS, "Invalid Args (" + detail + ")");
    }
}
