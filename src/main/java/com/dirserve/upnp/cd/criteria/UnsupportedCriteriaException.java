/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.criteria;

/**
 * Thrown when search criteria cannot be parsed or use a property the target
 * table does not have.
 */
public class UnsupportedCriteriaException extends Exception {

    public UnsupportedCriteriaException(String message) {
        super(message);
    }
}
