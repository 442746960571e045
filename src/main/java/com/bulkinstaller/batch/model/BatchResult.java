/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.batch.model;

import com.bulkinstaller.batch.BatchExitCode;
import com.bulkinstaller.packagemanager.models.ProcessResult;
import lombok.Value;

import java.util.List;

@Value
public class BatchResult {
    String batchId;
    boolean dryRun;
    List<ProcessResult> results;
    BatchSummary summary;

    public int getExitCode() {
        return BatchExitCode.of(results);
    }
}
