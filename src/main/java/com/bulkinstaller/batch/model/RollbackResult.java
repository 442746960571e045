/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.batch.model;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a batch rollback. The rollback is only successful when no row failed.
 */
@Value
public class RollbackResult {
    String batchId;
    List<RollbackEntry> results;
    List<String> failures;

    /**
     * Constructor.
     *
     * @param batchId  rolled back batch
     * @param results  per-row results in manifest order
     * @param failures failure messages
     */
    public RollbackResult(String batchId, List<RollbackEntry> results, List<String> failures) {
        this.batchId = batchId;
        this.results = Collections.unmodifiableList(results);
        this.failures = Collections.unmodifiableList(failures);
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }
}
