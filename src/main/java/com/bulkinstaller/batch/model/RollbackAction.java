/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.batch.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RollbackAction {
    RESTORE("restore"),
    REMOVE("remove"),
    SKIPPED("skipped");

    private final String value;

    RollbackAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
