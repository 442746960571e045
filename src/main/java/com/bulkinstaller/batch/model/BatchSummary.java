/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.batch.model;

import com.bulkinstaller.packagemanager.models.PackageAction;
import com.bulkinstaller.packagemanager.models.ProcessResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Aggregate counts of a batch. Every result lands in at most one of installed, updated, failed and incompatible;
 * skipped results land in none. {@code rolledBack} overlaps {@code failed}.
 */
@Value
@Builder
@Jacksonized
public class BatchSummary {
    public static final BatchSummary EMPTY = BatchSummary.builder().build();

    int total;
    int installed;
    int updated;
    int failed;
    int incompatible;
    int rolledBack;

    /**
     * Fold a list of results into a summary.
     *
     * @param results per-item results
     * @return summary
     */
    public static BatchSummary of(List<ProcessResult> results) {
        int installed = 0;
        int updated = 0;
        int failed = 0;
        int incompatible = 0;
        int rolledBack = 0;
        for (ProcessResult result : results) {
            if (result.isRolledBack()) {
                rolledBack++;
            }
            switch (result.getStatus()) {
                case SUCCESS:
                    if (result.getAction() == PackageAction.UPDATE) {
                        updated++;
                    } else {
                        installed++;
                    }
                    break;
                case FAILED:
                    failed++;
                    break;
                case INCOMPATIBLE:
                    incompatible++;
                    break;
                default:
                    break;
            }
        }
        return BatchSummary.builder()
                .total(results.size())
                .installed(installed)
                .updated(updated)
                .failed(failed)
                .incompatible(incompatible)
                .rolledBack(rolledBack)
                .build();
    }

    @JsonIgnore
    public int getSucceeded() {
        return installed + updated;
    }
}
