/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.batch;

import com.bulkinstaller.packagemanager.models.ProcessResult;

import java.util.List;

/**
 * Process exit code of a batch, for command-line front-ends.
 */
public final class BatchExitCode {
    public static final int SUCCESS = 0;
    public static final int PARTIAL_FAILURE = 1;
    public static final int FAILURE = 2;

    private BatchExitCode() {
    }

    /**
     * Classify a batch.
     *
     * @param results per-item results
     * @return {@value #SUCCESS} when every item succeeded or there was nothing to do, {@value #FAILURE} when no item
     *     succeeded, {@value #PARTIAL_FAILURE} otherwise
     */
    public static int of(List<ProcessResult> results) {
        if (results == null || results.isEmpty()) {
            return SUCCESS;
        }
        long succeeded = results.stream().filter(ProcessResult::isSuccessful).count();
        if (succeeded == results.size()) {
            return SUCCESS;
        }
        return succeeded == 0 ? FAILURE : PARTIAL_FAILURE;
    }
}
