/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.batch;

import com.bulkinstaller.batch.model.BatchManifest;
import com.bulkinstaller.batch.model.BatchResult;
import com.bulkinstaller.batch.model.ManifestEntry;
import com.bulkinstaller.batch.model.RollbackResult;
import com.bulkinstaller.config.InstallerConfiguration;
import com.bulkinstaller.notification.LoggingNotificationRelay;
import com.bulkinstaller.notification.NotificationFormatter;
import com.bulkinstaller.notification.NotificationRelay;
import com.bulkinstaller.notification.models.BatchNotification;
import com.bulkinstaller.notification.models.RollbackNotification;
import com.bulkinstaller.oplog.FileOperationLog;
import com.bulkinstaller.oplog.OperationLog;
import com.bulkinstaller.packagemanager.ArchivePackageInstaller;
import com.bulkinstaller.packagemanager.BackupStore;
import com.bulkinstaller.packagemanager.ItemProcessor;
import com.bulkinstaller.packagemanager.PackageActivator;
import com.bulkinstaller.packagemanager.PackageInstaller;
import com.bulkinstaller.packagemanager.PackagePaths;
import com.bulkinstaller.packagemanager.StoredPackageActivator;
import com.bulkinstaller.packagemanager.models.PackageItem;
import com.bulkinstaller.packagemanager.models.ProcessResult;
import com.bulkinstaller.store.FileExpiringStore;
import com.bulkinstaller.util.Utils;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point of the engine: runs batches, records them for a later rollback and notifies about both.
 */
public class BatchCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(BatchCoordinator.class);
    private static final String BATCH_ID_LOG_KEY = "batchId";

    private final BatchProcessor batchProcessor;
    private final BatchManifestStore manifestStore;
    private final BackupStore backupStore;
    private final NotificationRelay notificationRelay;
    private final NotificationFormatter formatter = new NotificationFormatter();
    private final InstallerConfiguration configuration;
    private final Clock clock;

    /**
     * Constructor.
     *
     * @param batchProcessor    batch processor
     * @param manifestStore     manifest store
     * @param backupStore       backup store, to drop backups of batches that couldn't be recorded
     * @param notificationRelay notification relay
     * @param configuration     installer settings
     * @param clock             clock
     */
    public BatchCoordinator(BatchProcessor batchProcessor, BatchManifestStore manifestStore, BackupStore backupStore,
                            NotificationRelay notificationRelay, InstallerConfiguration configuration, Clock clock) {
        this.batchProcessor = batchProcessor;
        this.manifestStore = manifestStore;
        this.backupStore = backupStore;
        this.notificationRelay = notificationRelay;
        this.configuration = configuration;
        this.clock = clock;
    }

    /**
     * Wire a coordinator installing from archives, keeping activation state on disk and logging notifications.
     *
     * @param configuration installer settings
     * @param clock         clock
     * @return coordinator
     */
    public static BatchCoordinator create(InstallerConfiguration configuration, Clock clock) {
        PackagePaths paths = new PackagePaths(configuration);
        return create(configuration, new ArchivePackageInstaller(paths), new StoredPackageActivator(
                FileExpiringStore.of(paths.activationPath(), new TypeReference<List<String>>() {}, clock), paths),
                new LoggingNotificationRelay(), clock);
    }

    /**
     * Wire a coordinator keeping its state in the directories named by the configuration.
     *
     * @param configuration     installer settings
     * @param installer         installer primitive
     * @param activator         activation primitive
     * @param notificationRelay notification relay
     * @param clock             clock
     * @return coordinator
     */
    public static BatchCoordinator create(InstallerConfiguration configuration, PackageInstaller installer,
                                          PackageActivator activator, NotificationRelay notificationRelay,
                                          Clock clock) {
        PackagePaths paths = new PackagePaths(configuration);
        BackupStore backupStore = new BackupStore(paths, clock);
        OperationLog operationLog = new FileOperationLog(paths.operationLogPath());
        ItemProcessor itemProcessor = new ItemProcessor(backupStore, installer, activator, paths, configuration);
        BatchManifestStore manifestStore = new BatchManifestStore(backupStore, paths,
                FileExpiringStore.of(paths.manifestPath(), BatchManifest.class, clock),
                FileExpiringStore.of(paths.statePath(), new TypeReference<List<String>>() {}, clock),
                operationLog, configuration, clock);
        return new BatchCoordinator(new BatchProcessor(itemProcessor, operationLog, clock), manifestStore,
                backupStore, notificationRelay, configuration, clock);
    }

    /**
     * Run a batch. Unless it is a dry run the batch is recorded for rollback, when recording is enabled, and a
     * notification is sent.
     *
     * @param items  packages in processing order
     * @param dryRun simulate every item
     * @param userId user running the batch, may be null
     * @return batch result
     * @throws IllegalArgumentException if there are no items
     */
    public BatchResult run(List<PackageItem> items, boolean dryRun, Long userId) {
        boolean record = !dryRun && configuration.isRecordBatches();
        BatchResult result = batchProcessor.processBatch(items, dryRun, null, userId, record);

        if (record) {
            record(result, userId);
        }
        if (!dryRun) {
            notifyCompleted(result, userId);
        }
        logger.atInfo().addKeyValue(BATCH_ID_LOG_KEY, result.getBatchId()).log(formatter.adminNotice(
                result.getSummary()));
        return result;
    }

    /**
     * Undo a recorded batch and send a rollback notification.
     *
     * @param batchId batch id
     * @param userId  user requesting the rollback, may be null
     * @param reason  reason given for the rollback, may be null
     * @return rollback result
     */
    public RollbackResult rollback(String batchId, Long userId, String reason) {
        RollbackResult result = manifestStore.rollbackBatch(batchId, userId);
        if (configuration.isEmailNotifications()) {
            RollbackNotification notification = RollbackNotification.builder()
                    .batchId(batchId)
                    .userId(userId)
                    .timestamp(clock.millis())
                    .reason(reason)
                    .entries(result.getResults())
                    .recipients(configuration.getEmailRecipients())
                    .build();
            relay(batchId, () -> notificationRelay.batchRolledBack(notification));
        }
        return result;
    }

    public List<BatchManifest> getActiveBatches() {
        return manifestStore.getActiveBatches();
    }

    public int cleanupExpired() {
        return manifestStore.cleanupExpired();
    }

    private void record(BatchResult result, Long userId) {
        BatchManifest manifest = BatchManifest.builder()
                .plugins(result.getResults().stream().map(ManifestEntry::from).collect(Collectors.toList()))
                .summary(result.getSummary())
                .userId(userId)
                .build();
        try {
            manifestStore.recordBatch(result.getBatchId(), manifest);
        } catch (IOException e) {
            logger.atError().addKeyValue(BATCH_ID_LOG_KEY, result.getBatchId()).setCause(e)
                    .log("Unable to record batch, it can't be rolled back");
            // nothing will ever reference the retained backups now
            for (ProcessResult r : result.getResults()) {
                if (Utils.isNotEmpty(r.getBackupPath()) && r.isSuccessful()) {
                    backupStore.cleanupBackup(Paths.get(r.getBackupPath()));
                }
            }
        }
    }

    private void notifyCompleted(BatchResult result, Long userId) {
        if (!configuration.isEmailNotifications()) {
            return;
        }
        BatchNotification notification = BatchNotification.builder()
                .batchId(result.getBatchId())
                .userId(userId)
                .timestamp(clock.millis())
                .results(result.getResults())
                .summary(result.getSummary())
                .recipients(configuration.getEmailRecipients())
                .build();
        relay(result.getBatchId(), () -> notificationRelay.batchCompleted(notification));
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private void relay(String batchId, Runnable delivery) {
        try {
            delivery.run();
        } catch (RuntimeException e) {
            logger.atWarn().addKeyValue(BATCH_ID_LOG_KEY, batchId).setCause(e).log("Unable to deliver notification");
        }
    }
}
