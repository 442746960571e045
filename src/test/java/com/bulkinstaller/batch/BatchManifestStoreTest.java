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
import com.bulkinstaller.oplog.InMemoryOperationLog;
import com.bulkinstaller.oplog.OperationLogEntry;
import com.bulkinstaller.packagemanager.BackupStore;
import com.bulkinstaller.packagemanager.PackagePaths;
import com.bulkinstaller.packagemanager.models.PackageAction;
import com.bulkinstaller.packagemanager.models.ProcessStatus;
import com.bulkinstaller.store.ExpiringStore;
import com.bulkinstaller.store.InMemoryExpiringStore;
import com.bulkinstaller.testcommons.MutableClock;
import com.bulkinstaller.testcommons.PackageFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.io.FileMatchers.anExistingDirectory;
import static org.hamcrest.io.FileMatchers.anExistingFileOrDirectory;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class BatchManifestStoreTest {
    private static final long START = 1_700_000_000L;

    @TempDir
    Path root;

    private MutableClock clock;
    private PackagePaths packagePaths;
    private BackupStore backupStore;
    private InMemoryExpiringStore<BatchManifest> manifests;
    private InMemoryExpiringStore<List<String>> registry;
    private InMemoryOperationLog operationLog;

    @BeforeEach
    void beforeEach() {
        clock = MutableClock.startingAt(START);
        packagePaths = new PackagePaths(root.resolve("plugins"), root.resolve("backups"), root.resolve("state"));
        backupStore = new BackupStore(packagePaths, clock);
        manifests = new InMemoryExpiringStore<>(clock);
        registry = new InMemoryExpiringStore<>(clock);
        operationLog = new InMemoryOperationLog();
    }

    @Test
    void GIVEN_manifest_WHEN_record_THEN_stamped_and_registered() throws Exception {
        BatchManifestStore store = store(InstallerConfiguration.builder().rollbackRetentionHours(2).build());

        BatchManifest recorded = store.recordBatch("b1", manifest(installRow("hello")));

        assertEquals("b1", recorded.getBatchId());
        assertEquals(START * 1000, recorded.getCreatedAt());
        assertEquals(START * 1000 + Duration.ofHours(2).toMillis(), recorded.getExpiresAt());
        assertEquals(0L, recorded.getUserId());
        assertEquals(recorded, store.getBatchManifest("b1"));
        assertThat(registry.get(BatchManifestStore.REGISTRY_KEY).get(), contains("b1"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void GIVEN_registry_write_fails_WHEN_record_THEN_manifest_removed_and_error_thrown() throws Exception {
        ExpiringStore<List<String>> failingRegistry = mock(ExpiringStore.class);
        doThrow(new IOException("disk full")).when(failingRegistry).put(eq(BatchManifestStore.REGISTRY_KEY), any(),
                any());
        BatchManifestStore store = new BatchManifestStore(backupStore, packagePaths, manifests, failingRegistry,
                operationLog, InstallerConfiguration.defaults(), clock);

        IOException e = assertThrows(IOException.class, () -> store.recordBatch("b1", manifest(installRow("hello"))));

        assertEquals("disk full", e.getMessage());
        assertTrue(store.getBatchManifest("b1").isEmpty());
        assertThat(manifests.keys(), empty());
    }

    @Test
    void GIVEN_same_batch_id_WHEN_recorded_twice_THEN_registered_once() throws Exception {
        BatchManifestStore store = store(InstallerConfiguration.defaults());

        store.recordBatch("b1", manifest(installRow("hello")));
        store.recordBatch("b1", manifest(installRow("hello")));
        store.recordBatch("b2", manifest(installRow("world")));

        assertThat(registry.get(BatchManifestStore.REGISTRY_KEY).get(), contains("b1", "b2"));
    }

    @Test
    void GIVEN_retention_zero_WHEN_record_THEN_expires_after_24_hours() throws Exception {
        BatchManifestStore store = store(InstallerConfiguration.builder().rollbackRetentionHours(0).build());

        BatchManifest recorded = store.recordBatch("b1", manifest(installRow("hello")));
        assertEquals(Duration.ofHours(24).toMillis(), recorded.getExpiresAt() - recorded.getCreatedAt());

        clock.advance(Duration.ofHours(23));
        assertFalse(store.getBatchManifest("b1").isEmpty());
        assertThat(store.getActiveBatches(), hasSize(1));

        clock.advance(Duration.ofHours(2));
        assertTrue(store.getBatchManifest("b1").isEmpty());
        assertThat(store.getActiveBatches(), empty());
    }

    @Test
    void GIVEN_update_row_with_empty_backup_path_WHEN_rollback_THEN_failed_row_and_one_failure() throws Exception {
        BatchManifestStore store = store(InstallerConfiguration.defaults());
        store.recordBatch("b1", manifest(updateRow("akismet", "")));

        RollbackResult result = store.rollbackBatch("b1");

        assertFalse(result.isSuccess());
        assertThat(result.getFailures(), contains("No backup path for \"akismet\"."));
        assertThat(result.getResults(), hasSize(1));
        assertEquals(ProcessStatus.FAILED, result.getResults().get(0).getStatus());
        assertEquals(RollbackAction.RESTORE, result.getResults().get(0).getAction());
        assertEquals("partial", operationLog.getEntries().get(0).getStatus());
    }

    @Test
    void GIVEN_recorded_batch_WHEN_rollback_THEN_pre_batch_state_restored_and_batch_forgotten() throws Exception {
        Path updated = PackageFixtures.createPackage(packagePaths.pluginsPath(), "akismet", "5.0");
        Path backup = backupStore.createBackup(updated);
        Files.write(updated.resolve("akismet.php"), "Version: 5.1".getBytes(StandardCharsets.UTF_8));
        Path installed = PackageFixtures.createPackage(packagePaths.pluginsPath(), "hello", "1.0");
        Path untouched = PackageFixtures.createPackage(packagePaths.pluginsPath(), "jetpack", "12.0");

        BatchManifestStore store = store(InstallerConfiguration.defaults());
        store.recordBatch("b1", manifest(
                updateRow("akismet", backup.toString()),
                installRow("hello"),
                ManifestEntry.builder().slug("jetpack").action(PackageAction.INSTALL).status(ProcessStatus.FAILED)
                        .build()));

        RollbackResult result = store.rollbackBatch("b1", 3L);

        assertTrue(result.isSuccess());
        assertThat(result.getResults().stream().map(RollbackEntry::getAction).collect(Collectors.toList()),
                contains(RollbackAction.RESTORE, RollbackAction.REMOVE, RollbackAction.SKIPPED));
        assertThat(result.getResults().stream().map(RollbackEntry::getStatus).collect(Collectors.toList()),
                contains(ProcessStatus.SUCCESS, ProcessStatus.SUCCESS, ProcessStatus.SKIPPED));
        assertEquals("Restored \"akismet\" to previous version.", result.getResults().get(0).getMessage());
        assertEquals("5.0", PackageFixtures.readVersion(updated));
        assertThat(backup.toFile(), not(anExistingFileOrDirectory()));
        assertThat(installed.toFile(), not(anExistingFileOrDirectory()));
        assertThat(untouched.toFile(), anExistingDirectory());

        assertTrue(store.getBatchManifest("b1").isEmpty());
        assertThat(registry.get(BatchManifestStore.REGISTRY_KEY).get(), empty());
        OperationLogEntry logEntry = operationLog.getEntries().get(0);
        assertEquals(OperationLogEntry.ACTION_BATCH_ROLLBACK, logEntry.getAction());
        assertEquals("b1", logEntry.getBatchId());
        assertEquals("success", logEntry.getStatus());
        assertEquals("Batch rollback completed successfully.", logEntry.getMessage());
        assertEquals(3L, logEntry.getUserId());
    }

    @Test
    void GIVEN_restore_fails_WHEN_rollback_THEN_remaining_rows_still_processed() throws Exception {
        Path installed = PackageFixtures.createPackage(packagePaths.pluginsPath(), "hello", "1.0");
        BatchManifestStore store = store(InstallerConfiguration.defaults());
        store.recordBatch("b1", manifest(
                updateRow("akismet", packagePaths.backupPath().resolve("vanished").toString()),
                installRow("hello")));

        RollbackResult result = store.rollbackBatch("b1");

        assertFalse(result.isSuccess());
        assertThat(result.getFailures(), hasSize(1));
        assertThat(result.getFailures().get(0), startsWith("Failed to restore \"akismet\": "));
        assertEquals(ProcessStatus.SUCCESS, result.getResults().get(1).getStatus());
        assertThat(installed.toFile(), not(anExistingFileOrDirectory()));
        assertThat(operationLog.getEntries().get(0).getMessage(),
                startsWith("Batch rollback completed with errors: Failed to restore \"akismet\""));
        assertTrue(store.getBatchManifest("b1").isEmpty());
    }

    @Test
    void GIVEN_unknown_batch_WHEN_rollback_THEN_not_found_and_nothing_logged() {
        RollbackResult result = store(InstallerConfiguration.defaults()).rollbackBatch("nope");

        assertFalse(result.isSuccess());
        assertThat(result.getFailures(), contains("Batch manifest not found."));
        assertThat(result.getResults(), empty());
        assertEquals(0, operationLog.size());
    }

    @Test
    void GIVEN_expired_and_valid_batches_WHEN_cleanup_expired_THEN_only_expired_removed() throws Exception {
        BatchManifestStore store = store(InstallerConfiguration.builder().rollbackRetentionHours(1).build());
        Path expiredBackup = backupStore.createBackup(
                PackageFixtures.createPackage(packagePaths.pluginsPath(), "akismet", "5.0"));
        store.recordBatch("old", manifest(updateRow("akismet", expiredBackup.toString())));

        clock.advance(Duration.ofHours(2));
        Path validBackup = backupStore.createBackup(
                PackageFixtures.createPackage(packagePaths.pluginsPath(), "jetpack", "12.0"));
        store.recordBatch("new", manifest(updateRow("jetpack", validBackup.toString())));

        // expired by its own expiresAt but still held by the store
        assertTrue(manifests.get(BatchManifestStore.MANIFEST_KEY_PREFIX + "old").isPresent());

        assertEquals(1, store.cleanupExpired());

        assertThat(expiredBackup.toFile(), not(anExistingFileOrDirectory()));
        assertThat(validBackup.toFile(), anExistingDirectory());
        assertThat(registry.get(BatchManifestStore.REGISTRY_KEY).get(), contains("new"));
        assertFalse(manifests.get(BatchManifestStore.MANIFEST_KEY_PREFIX + "old").isPresent());
        assertFalse(store.getBatchManifest("new").isEmpty());
    }

    @Test
    void GIVEN_registered_id_without_manifest_WHEN_cleanup_expired_THEN_id_dropped() throws Exception {
        registry.put(BatchManifestStore.REGISTRY_KEY, Arrays.asList("ghost", "b1"), null);
        BatchManifestStore store = store(InstallerConfiguration.defaults());
        store.recordBatch("b1", manifest(installRow("hello")));

        assertThat(store.getActiveBatches(), hasSize(1));
        assertEquals(1, store.cleanupExpired());
        assertThat(registry.get(BatchManifestStore.REGISTRY_KEY).get(), contains("b1"));
        assertEquals(0, store.cleanupExpired());
    }

    private BatchManifestStore store(InstallerConfiguration configuration) {
        return new BatchManifestStore(backupStore, packagePaths, manifests, registry, operationLog, configuration,
                clock);
    }

    private static BatchManifest manifest(ManifestEntry... rows) {
        return BatchManifest.builder().plugins(Arrays.asList(rows)).build();
    }

    private static ManifestEntry installRow(String slug) {
        return ManifestEntry.builder().slug(slug).name(slug).action(PackageAction.INSTALL).newVersion("1.0")
                .status(ProcessStatus.SUCCESS).packageDescriptor(slug + "/" + slug + ".php").build();
    }

    private static ManifestEntry updateRow(String slug, String backupPath) {
        return ManifestEntry.builder().slug(slug).name(slug).action(PackageAction.UPDATE).previousVersion("5.0")
                .newVersion("5.1").backupPath(backupPath).status(ProcessStatus.SUCCESS)
                .packageDescriptor(slug + "/" + slug + ".php").build();
    }
}
