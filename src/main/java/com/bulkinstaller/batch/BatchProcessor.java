/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.batch;

import com.bulkinstaller.batch.model.BatchResult;
import com.bulkinstaller.batch.model.BatchSummary;
import com.bulkinstaller.oplog.OperationLog;
import com.bulkinstaller.oplog.OperationLogEntry;
import com.bulkinstaller.packagemanager.ItemProcessor;
import com.bulkinstaller.packagemanager.models.PackageItem;
import com.bulkinstaller.packagemanager.models.ProcessResult;
import com.bulkinstaller.packagemanager.models.ProcessStatus;
import com.bulkinstaller.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs a list of packages through the {@link ItemProcessor} one after another. A failing item never stops the
 * items after it.
 */
public class BatchProcessor {
    static final String BATCH_ID_PREFIX = "bpi_";
    static final int BATCH_ID_SUFFIX_LENGTH = 6;

    private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);
    private static final String BATCH_ID_LOG_KEY = "batchId";

    private final ItemProcessor itemProcessor;
    private final OperationLog operationLog;
    private final Clock clock;

    /**
     * Constructor.
     *
     * @param itemProcessor item processor
     * @param operationLog  log receiving one entry per item
     * @param clock         clock for batch ids and log timestamps
     */
    public BatchProcessor(ItemProcessor itemProcessor, OperationLog operationLog, Clock clock) {
        this.itemProcessor = itemProcessor;
        this.operationLog = operationLog;
        this.clock = clock;
    }

    public BatchResult processBatch(List<PackageItem> items, boolean dryRun) {
        return processBatch(items, dryRun, null, null, false);
    }

    /**
     * Process a batch.
     *
     * @param items         packages in processing order
     * @param dryRun        simulate every item
     * @param batchId       id of the batch, generated when null or empty
     * @param userId        user running the batch, may be null
     * @param retainBackups keep the backups of successful updates for a later batch rollback
     * @return per-item results and summary
     * @throws IllegalArgumentException if there are no items
     */
    public BatchResult processBatch(List<PackageItem> items, boolean dryRun, String batchId, Long userId,
                                    boolean retainBackups) {
        if (Utils.isEmpty(items)) {
            throw new IllegalArgumentException("No packages to process.");
        }
        String id = Utils.isEmpty(batchId) ? generateBatchId(userId) : batchId;
        logger.atInfo().addKeyValue(BATCH_ID_LOG_KEY, id).addKeyValue("count", items.size())
                .addKeyValue("dryRun", dryRun).log("Starting batch");

        List<ProcessResult> results = new ArrayList<>(items.size());
        for (PackageItem item : items) {
            ProcessResult result = processItem(item, dryRun, retainBackups);
            results.add(result);
            operationLog.append(toLogEntry(result, id, userId));
        }

        BatchSummary summary = BatchSummary.of(results);
        logger.atInfo().addKeyValue(BATCH_ID_LOG_KEY, id).addKeyValue("succeeded", summary.getSucceeded())
                .addKeyValue("failed", summary.getFailed()).addKeyValue("incompatible", summary.getIncompatible())
                .addKeyValue("rolledBack", summary.getRolledBack()).log("Finished batch");
        return new BatchResult(id, dryRun, Collections.unmodifiableList(results), summary);
    }

    /**
     * Generate a batch id of the form {@code bpi_<epochSeconds>_<userId>_<random>}.
     *
     * @param userId user running the batch, 0 when unknown
     * @return batch id
     */
    public String generateBatchId(Long userId) {
        return String.format("%s%d_%d_%s", BATCH_ID_PREFIX, clock.instant().getEpochSecond(),
                userId == null ? 0L : userId, Utils.generateRandomString(BATCH_ID_SUFFIX_LENGTH));
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private ProcessResult processItem(PackageItem item, boolean dryRun, boolean retainBackups) {
        try {
            return itemProcessor.process(item, dryRun, retainBackups);
        } catch (RuntimeException e) {
            logger.atError().addKeyValue("slug", item.getSlug()).setCause(e)
                    .log("Unexpected error while processing package");
            return ProcessResult.builder()
                    .slug(item.getSlug())
                    .name(item.getDisplayName())
                    .action(item.getAction())
                    .status(ProcessStatus.FAILED)
                    .dryRun(dryRun)
                    .fromVersion(item.isUpdate() ? item.getInstalledVersion() : null)
                    .toVersion(item.getTargetVersion())
                    .packageDescriptor(item.getEffectiveDescriptor())
                    .message(String.format("Failed to %s \"%s\": %s", item.getAction(), item.getDisplayName(),
                            Utils.getUltimateMessage(e)))
                    .build();
        }
    }

    private OperationLogEntry toLogEntry(ProcessResult result, String batchId, Long userId) {
        return OperationLogEntry.builder()
                .action(result.getAction().getValue())
                .batchId(batchId)
                .slug(result.getSlug())
                .name(result.getName())
                .fromVersion(result.getFromVersion())
                .toVersion(result.getToVersion())
                .status(result.getStatus().getValue())
                .message(result.joinedMessages())
                .dryRun(result.isDryRun())
                .userId(userId)
                .timestamp(clock.millis())
                .build();
    }
}
