/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.notification.models;

import com.bulkinstaller.batch.model.BatchSummary;
import com.bulkinstaller.packagemanager.models.ProcessResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BatchNotification {
    String batchId;
    Long userId;
    long timestamp;
    @Singular
    List<ProcessResult> results;
    BatchSummary summary;
    @Singular
    List<String> recipients;
}
