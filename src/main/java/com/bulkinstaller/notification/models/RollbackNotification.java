/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.notification.models;

import com.bulkinstaller.batch.model.RollbackEntry;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RollbackNotification {
    String batchId;
    Long userId;
    long timestamp;
    String reason;
    @Singular
    List<RollbackEntry> entries;
    @Singular
    List<String> recipients;
}
