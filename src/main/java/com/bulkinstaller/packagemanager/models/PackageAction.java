/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PackageAction {
    INSTALL("install"),
    UPDATE("update");

    private final String value;

    PackageAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse an action name, case-insensitively.
     *
     * @param value action name
     * @return action
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static PackageAction fromValue(String value) {
        for (PackageAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown package action " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
