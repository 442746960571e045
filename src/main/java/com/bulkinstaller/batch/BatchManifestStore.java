/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.batch;

import com.bulkinstaller.batch.model.BatchManifest;
import com.bulkinstaller.batch.model.ManifestEntry;
import com.bulkinstaller.batch.model.RollbackAction;
import com.bulkinstaller.batch.model.RollbackEntry;
import com.bulkinstaller.batch.model.RollbackResult;
import com.bulkinstaller.config.InstallerConfiguration;
import com.bulkinstaller.oplog.OperationLog;
import com.bulkinstaller.oplog.OperationLogEntry;
import com.bulkinstaller.packagemanager.BackupStore;
import com.bulkinstaller.packagemanager.PackagePaths;
import com.bulkinstaller.packagemanager.exceptions.RestoreException;
import com.bulkinstaller.packagemanager.models.PackageAction;
import com.bulkinstaller.packagemanager.models.ProcessStatus;
import com.bulkinstaller.store.ExpiringStore;
import com.bulkinstaller.util.LockScope;
import com.bulkinstaller.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.bulkinstaller.errorcode.InstallerErrorCode.BATCH_NOT_FOUND;
import static com.bulkinstaller.errorcode.InstallerErrorCode.IO_ERROR;
import static com.bulkinstaller.errorcode.InstallerErrorCode.MISSING_BACKUP_PATH;

/**
 * Persists batch manifests for a limited time and undoes recorded batches.
 *
 * <p>Manifests are kept in an {@link ExpiringStore} under {@value #MANIFEST_KEY_PREFIX}{@code <batchId>}. The ids of
 * recorded batches are tracked in a registry kept under {@value #REGISTRY_KEY} which never expires. A manifest stays
 * in storage for a grace period after its own {@code expiresAt} so the expiry sweep can still find the backups it
 * references; it is reported as absent as soon as {@code expiresAt} has passed.</p>
 */
public class BatchManifestStore {
    public static final String MANIFEST_KEY_PREFIX = "bpi_batch_";
    public static final String REGISTRY_KEY = "bpi_active_batches";
    static final Duration STORAGE_GRACE = Duration.ofHours(24);
    static final long UNKNOWN_USER = 0L;

    static final String MANIFEST_NOT_FOUND = "Batch manifest not found.";
    static final String ROLLBACK_SUCCESS = "Batch rollback completed successfully.";
    static final String STATUS_PARTIAL = "partial";

    private static final Logger logger = LoggerFactory.getLogger(BatchManifestStore.class);
    private static final String BATCH_ID_LOG_KEY = "batchId";
    private static final String ERROR_CODE_LOG_KEY = "errorCode";

    private final BackupStore backupStore;
    private final PackagePaths packagePaths;
    private final ExpiringStore<BatchManifest> manifests;
    private final ExpiringStore<List<String>> registry;
    private final OperationLog operationLog;
    private final InstallerConfiguration configuration;
    private final Clock clock;
    private final ReadWriteLock registryLock = new ReentrantReadWriteLock();

    /**
     * Constructor.
     *
     * @param backupStore   backup store used to restore updated packages
     * @param packagePaths  package paths
     * @param manifests     storage of the manifests
     * @param registry      storage of the batch id registry
     * @param operationLog  log receiving one entry per batch rollback
     * @param configuration installer settings, for the retention period
     * @param clock         clock
     */
    @SuppressWarnings("PMD.ExcessiveParameterList")
    public BatchManifestStore(BackupStore backupStore, PackagePaths packagePaths,
                              ExpiringStore<BatchManifest> manifests, ExpiringStore<List<String>> registry,
                              OperationLog operationLog, InstallerConfiguration configuration, Clock clock) {
        this.backupStore = backupStore;
        this.packagePaths = packagePaths;
        this.manifests = manifests;
        this.registry = registry;
        this.operationLog = operationLog;
        this.configuration = configuration;
        this.clock = clock;
    }

    /**
     * Store the manifest of a finished batch and register its id.
     *
     * @param batchId  batch id
     * @param manifest manifest rows and summary; id, timestamps and a missing user are filled in here
     * @return manifest as stored
     * @throws IOException if the manifest or the registry can't be persisted
     */
    public BatchManifest recordBatch(String batchId, BatchManifest manifest) throws IOException {
        long now = clock.millis();
        Duration retention = Duration.ofSeconds(configuration.getRetentionSeconds());
        BatchManifest stamped = manifest.toBuilder()
                .batchId(batchId)
                .userId(manifest.getUserId() == null ? UNKNOWN_USER : manifest.getUserId())
                .createdAt(now)
                .expiresAt(now + retention.toMillis())
                .build();
        manifests.put(MANIFEST_KEY_PREFIX + batchId, stamped, retention.plus(STORAGE_GRACE));

        try (LockScope ls = LockScope.write(registryLock)) {
            List<String> ids = new ArrayList<>(readRegistry());
            if (!ids.contains(batchId)) {
                ids.add(batchId);
                registry.put(REGISTRY_KEY, ids, null);
            }
        } catch (IOException e) {
            // an unregistered manifest would never be swept
            removeManifest(batchId);
            throw e;
        }
        logger.atInfo().addKeyValue(BATCH_ID_LOG_KEY, batchId).addKeyValue("packages", stamped.getPlugins().size())
                .addKeyValue("expiresAt", stamped.getExpiresAt()).log("Recorded batch manifest");
        return stamped;
    }

    /**
     * Get the manifest of a batch.
     *
     * @param batchId batch id
     * @return manifest, or {@link BatchManifest#EMPTY} when it is unknown or has expired
     */
    public BatchManifest getBatchManifest(String batchId) {
        return readManifest(batchId).filter(m -> !m.isExpired(clock.millis())).orElse(BatchManifest.EMPTY);
    }

    public RollbackResult rollbackBatch(String batchId) {
        return rollbackBatch(batchId, null);
    }

    /**
     * Undo a recorded batch: updated packages are restored from their backups and newly installed packages are
     * removed. Rows that fail are reported and the remaining rows are still processed. The batch is forgotten
     * afterwards, whatever the outcome.
     *
     * @param batchId batch id
     * @param userId  user requesting the rollback, may be null
     * @return per-row results and failures
     */
    public RollbackResult rollbackBatch(String batchId, Long userId) {
        BatchManifest manifest = getBatchManifest(batchId);
        if (manifest.isEmpty()) {
            logger.atWarn().addKeyValue(BATCH_ID_LOG_KEY, batchId).addKeyValue(ERROR_CODE_LOG_KEY, BATCH_NOT_FOUND)
                    .log("No manifest for batch rollback");
            return new RollbackResult(batchId, Collections.emptyList(),
                    Collections.singletonList(MANIFEST_NOT_FOUND));
        }

        List<RollbackEntry> results = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (ManifestEntry row : manifest.getPlugins()) {
            results.add(rollbackRow(row, failures));
        }

        operationLog.append(OperationLogEntry.builder()
                .action(OperationLogEntry.ACTION_BATCH_ROLLBACK)
                .batchId(batchId)
                .slug("")
                .name("")
                .status(failures.isEmpty() ? ProcessStatus.SUCCESS.getValue() : STATUS_PARTIAL)
                .message(failures.isEmpty() ? ROLLBACK_SUCCESS
                        : "Batch rollback completed with errors: " + String.join("; ", failures))
                .userId(userId)
                .timestamp(clock.millis())
                .build());

        forget(batchId);
        logger.atInfo().addKeyValue(BATCH_ID_LOG_KEY, batchId).addKeyValue("rows", results.size())
                .addKeyValue("failures", failures.size()).log("Rolled back batch");
        return new RollbackResult(batchId, results, failures);
    }

    /**
     * Manifests of every registered batch that hasn't expired, in registration order.
     *
     * @return manifests
     */
    public List<BatchManifest> getActiveBatches() {
        List<BatchManifest> active = new ArrayList<>();
        for (String batchId : registeredIds()) {
            BatchManifest manifest = getBatchManifest(batchId);
            if (!manifest.isEmpty()) {
                active.add(manifest);
            }
        }
        return active;
    }

    /**
     * Forget expired batches and delete the backups they kept.
     *
     * @return number of batches dropped from the registry
     */
    public int cleanupExpired() {
        int dropped = 0;
        try (LockScope ls = LockScope.write(registryLock)) {
            List<String> ids = readRegistry();
            List<String> stillActive = new ArrayList<>(ids.size());
            long now = clock.millis();
            for (String batchId : ids) {
                Optional<BatchManifest> manifest = readManifest(batchId);
                if (manifest.isPresent() && manifest.get().getExpiresAt() >= now) {
                    stillActive.add(batchId);
                    continue;
                }
                manifest.ifPresent(this::discardBackups);
                removeManifest(batchId);
                dropped++;
            }
            if (dropped > 0) {
                registry.put(REGISTRY_KEY, stillActive, null);
            }
            manifests.purgeExpired();
        } catch (IOException e) {
            logger.atError().addKeyValue(ERROR_CODE_LOG_KEY, IO_ERROR).setCause(e)
                    .log("Unable to clean up expired batches");
        }
        if (dropped > 0) {
            logger.atInfo().addKeyValue("dropped", dropped).log("Cleaned up expired batches");
        }
        return dropped;
    }

    private RollbackEntry rollbackRow(ManifestEntry row, List<String> failures) {
        String slug = row.getSlug();
        if (row.getStatus() != ProcessStatus.SUCCESS) {
            return RollbackEntry.of(slug, RollbackAction.SKIPPED, ProcessStatus.SKIPPED,
                    "Plugin was not successfully processed; skipping rollback.");
        }

        Path installDir;
        try {
            installDir = packagePaths.installPath(slug);
        } catch (IllegalArgumentException | NullPointerException e) {
            failures.add(String.format("Invalid package slug \"%s\".", slug));
            return RollbackEntry.of(slug, row.getAction() == PackageAction.UPDATE ? RollbackAction.RESTORE
                    : RollbackAction.REMOVE, ProcessStatus.FAILED, "Invalid package slug.");
        }

        if (row.getAction() != PackageAction.UPDATE) {
            backupStore.removePartialInstall(installDir);
            return RollbackEntry.of(slug, RollbackAction.REMOVE, ProcessStatus.SUCCESS,
                    String.format("Removed newly installed \"%s\".", slug));
        }

        if (Utils.isEmpty(row.getBackupPath())) {
            logger.atError().addKeyValue("slug", slug).addKeyValue(ERROR_CODE_LOG_KEY, MISSING_BACKUP_PATH)
                    .log("Updated package has no backup to restore");
            failures.add(String.format("No backup path for \"%s\".", slug));
            return RollbackEntry.of(slug, RollbackAction.RESTORE, ProcessStatus.FAILED, "No backup path available.");
        }

        Path backup = Paths.get(row.getBackupPath());
        try {
            backupStore.restoreBackup(backup, installDir);
        } catch (RestoreException e) {
            logger.atError().addKeyValue("slug", slug).addKeyValue(ERROR_CODE_LOG_KEY, e.getErrorCode()).setCause(e)
                    .log("Unable to restore package during batch rollback");
            failures.add(String.format("Failed to restore \"%s\": %s", slug, e.getMessage()));
            return RollbackEntry.of(slug, RollbackAction.RESTORE, ProcessStatus.FAILED, e.getMessage());
        }
        backupStore.cleanupBackup(backup);
        return RollbackEntry.of(slug, RollbackAction.RESTORE, ProcessStatus.SUCCESS,
                String.format("Restored \"%s\" to previous version.", slug));
    }

    private void discardBackups(BatchManifest manifest) {
        for (ManifestEntry row : manifest.getPlugins()) {
            if (Utils.isNotEmpty(row.getBackupPath())) {
                backupStore.cleanupBackup(Paths.get(row.getBackupPath()));
            }
        }
    }

    private void forget(String batchId) {
        removeManifest(batchId);
        try (LockScope ls = LockScope.write(registryLock)) {
            List<String> ids = new ArrayList<>(readRegistry());
            if (ids.remove(batchId)) {
                registry.put(REGISTRY_KEY, ids, null);
            }
        } catch (IOException e) {
            logger.atError().addKeyValue(BATCH_ID_LOG_KEY, batchId).setCause(e)
                    .log("Unable to remove batch from registry");
        }
    }

    private void removeManifest(String batchId) {
        try {
            manifests.remove(MANIFEST_KEY_PREFIX + batchId);
        } catch (IOException e) {
            logger.atError().addKeyValue(BATCH_ID_LOG_KEY, batchId).setCause(e).log("Unable to delete batch manifest");
        }
    }

    private Optional<BatchManifest> readManifest(String batchId) {
        if (Utils.isEmpty(batchId)) {
            return Optional.empty();
        }
        try {
            return manifests.get(MANIFEST_KEY_PREFIX + batchId);
        } catch (IOException e) {
            logger.atWarn().addKeyValue(BATCH_ID_LOG_KEY, batchId).setCause(e).log("Unable to read batch manifest");
            return Optional.empty();
        }
    }

    private List<String> registeredIds() {
        try (LockScope ls = LockScope.read(registryLock)) {
            return readRegistry();
        } catch (IOException e) {
            logger.atWarn().setCause(e).log("Unable to read batch registry");
            return Collections.emptyList();
        }
    }

    private List<String> readRegistry() throws IOException {
        return registry.get(REGISTRY_KEY).orElse(Collections.emptyList());
    }
}
