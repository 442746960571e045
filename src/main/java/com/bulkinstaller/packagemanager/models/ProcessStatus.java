/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProcessStatus {
    SUCCESS("success"),
    FAILED("failed"),
    INCOMPATIBLE("incompatible"),
    SKIPPED("skipped");

    private final String value;

    ProcessStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a status name, case-insensitively.
     *
     * @param value status name
     * @return status
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static ProcessStatus fromValue(String value) {
        for (ProcessStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown process status " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
