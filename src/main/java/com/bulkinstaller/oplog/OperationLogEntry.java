/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.oplog;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One record of the activity log. {@code action} is install, update or batch_rollback; {@code timestamp} is epoch
 * milliseconds.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class OperationLogEntry {
    public static final String ACTION_BATCH_ROLLBACK = "batch_rollback";

    String action;
    String batchId;
    String slug;
    String name;
    String fromVersion;
    String toVersion;
    String status;
    String message;
    boolean dryRun;
    Long userId;
    long timestamp;
}
