/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager;

import com.bulkinstaller.config.InstallerConfiguration;
import com.bulkinstaller.packagemanager.exceptions.ActivationException;
import com.bulkinstaller.packagemanager.exceptions.BackupException;
import com.bulkinstaller.packagemanager.exceptions.InstallerException;
import com.bulkinstaller.packagemanager.exceptions.RestoreException;
import com.bulkinstaller.packagemanager.models.CompatibilityIssue;
import com.bulkinstaller.packagemanager.models.PackageItem;
import com.bulkinstaller.packagemanager.models.ProcessResult;
import com.bulkinstaller.packagemanager.models.ProcessStatus;
import com.bulkinstaller.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Applies one install or update to one package.
 *
 * <p>Updates are protected by a backup of the installed directory: a failed update is restored from it when
 * automatic rollback is enabled. A failed new install has nothing to restore, so whatever it wrote is removed.
 * Activation problems never fail the item.</p>
 */
public class ItemProcessor {
    private static final Logger logger = LoggerFactory.getLogger(ItemProcessor.class);
    private static final String SLUG_LOG_KEY = "slug";
    private static final String ACTION_LOG_KEY = "action";

    private final BackupStore backupStore;
    private final PackageInstaller installer;
    private final PackageActivator activator;
    private final PackagePaths packagePaths;
    private final InstallerConfiguration configuration;

    /**
     * Constructor.
     *
     * @param backupStore   backup store
     * @param installer     installer primitive
     * @param activator     activation primitive
     * @param packagePaths  package paths
     * @param configuration installer settings
     */
    public ItemProcessor(BackupStore backupStore, PackageInstaller installer, PackageActivator activator,
                         PackagePaths packagePaths, InstallerConfiguration configuration) {
        this.backupStore = backupStore;
        this.installer = installer;
        this.activator = activator;
        this.packagePaths = packagePaths;
        this.configuration = configuration;
    }

    public ProcessResult process(PackageItem item, boolean dryRun) {
        return process(item, dryRun, false);
    }

    /**
     * Process one package.
     *
     * @param item         package to install or update
     * @param dryRun       report what would happen without touching the filesystem
     * @param retainBackup keep the backup of a successful update so the batch can be rolled back later
     * @return result of the item
     */
    public ProcessResult process(PackageItem item, boolean dryRun, boolean retainBackup) {
        ProcessResult.ProcessResultBuilder result = ProcessResult.builder()
                .slug(item.getSlug())
                .name(item.getDisplayName())
                .action(item.getAction())
                .dryRun(dryRun)
                .fromVersion(item.isUpdate() ? item.getInstalledVersion() : null)
                .toVersion(item.getTargetVersion())
                .packageDescriptor(item.getEffectiveDescriptor());

        ProcessResult processed;
        if (!item.getCompatibilityIssues().isEmpty()) {
            processed = incompatible(item, result, dryRun);
        } else if (dryRun) {
            processed = simulate(item, result);
        } else {
            processed = execute(item, result, retainBackup);
        }

        logger.atInfo().addKeyValue(SLUG_LOG_KEY, processed.getSlug()).addKeyValue(ACTION_LOG_KEY,
                processed.getAction()).addKeyValue("status", processed.getStatus())
                .addKeyValue("dryRun", dryRun).addKeyValue("rolledBack", processed.isRolledBack())
                .log("Processed package");
        return processed;
    }

    /**
     * Whether a package gets activated once installed. The item's own flag wins; without one the global
     * auto-activate setting applies.
     *
     * @param item package
     * @return true to activate
     */
    public boolean shouldActivate(PackageItem item) {
        if (item.getActivate() != null) {
            return item.getActivate();
        }
        return configuration.isAutoActivate();
    }

    private ProcessResult incompatible(PackageItem item, ProcessResult.ProcessResultBuilder result,
                                       boolean dryRun) {
        result.status(ProcessStatus.INCOMPATIBLE)
                .compatibilityIssues(item.getCompatibilityIssues())
                .message(String.format("Skipped \"%s\" due to compatibility issues.", item.getDisplayName()));
        for (CompatibilityIssue issue : item.getCompatibilityIssues()) {
            result.message(issue.getMessage());
        }
        if (dryRun) {
            result.message("No changes were made.");
        }
        return result.build();
    }

    private ProcessResult simulate(PackageItem item, ProcessResult.ProcessResultBuilder result) {
        result.status(ProcessStatus.SUCCESS)
                .message(String.format("Dry run: would %s \"%s\".", item.getAction(), item.getDisplayName()));
        if (shouldActivate(item)) {
            result.message(String.format("Would activate \"%s\" after installation.", item.getDisplayName()));
        }
        return result.message("No changes were made.").build();
    }

    private ProcessResult execute(PackageItem item, ProcessResult.ProcessResultBuilder result,
                                  boolean retainBackup) {
        Path installDir;
        try {
            installDir = packagePaths.installPath(item.getSlug());
        } catch (IllegalArgumentException | NullPointerException e) {
            return result.status(ProcessStatus.FAILED)
                    .message(String.format("Invalid package slug \"%s\".", item.getSlug()))
                    .build();
        }

        Path backupPath = null;
        if (item.isUpdate()) {
            try {
                backupPath = backupStore.createBackup(installDir);
            } catch (BackupException e) {
                logger.atError().addKeyValue(SLUG_LOG_KEY, item.getSlug()).addKeyValue("errorCode",
                        e.getErrorCode()).setCause(e).log("Unable to back up package before update");
                return result.status(ProcessStatus.FAILED)
                        .message(String.format("Failed to create backup for \"%s\": %s", item.getDisplayName(),
                                e.getMessage()))
                        .build();
            }
        }

        try {
            runInstaller(item);
        } catch (InstallerException e) {
            return handleInstallFailure(item, result, e, installDir, backupPath);
        }

        result.status(ProcessStatus.SUCCESS)
                .message(String.format("Successfully %s \"%s\".", item.isUpdate() ? "updated" : "installed",
                        item.getDisplayName()));
        handleActivation(item, result);

        if (backupPath != null) {
            if (retainBackup) {
                result.backupPath(backupPath.toString());
            } else {
                backupStore.cleanupBackup(backupPath);
            }
        }
        return result.build();
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private void runInstaller(PackageItem item) throws InstallerException {
        Path source = Utils.isEmpty(item.getSourcePath()) ? null : Paths.get(item.getSourcePath());
        try {
            if (item.isUpdate()) {
                installer.update(source, item.getEffectiveDescriptor());
            } else {
                installer.install(source, item.getEffectiveDescriptor());
            }
        } catch (RuntimeException e) {
            throw new InstallerException(Utils.getUltimateMessage(e), e);
        }
    }

    private ProcessResult handleInstallFailure(PackageItem item, ProcessResult.ProcessResultBuilder result,
                                               InstallerException cause, Path installDir, Path backupPath) {
        logger.atError().addKeyValue(SLUG_LOG_KEY, item.getSlug()).addKeyValue(ACTION_LOG_KEY, item.getAction())
                .setCause(cause).log("Package operation failed");
        result.status(ProcessStatus.FAILED)
                .message(String.format("Failed to %s \"%s\": %s", item.getAction(), item.getDisplayName(),
                        cause.getMessage()));

        if (backupPath == null) {
            backupStore.removePartialInstall(installDir);
            return result.build();
        }

        if (!configuration.isAutoRollback()) {
            return result.backupPath(backupPath.toString())
                    .message(String.format("Automatic rollback is disabled; backup kept at %s.", backupPath))
                    .build();
        }

        try {
            backupStore.restoreBackup(backupPath, installDir);
        } catch (RestoreException e) {
            logger.atError().addKeyValue(SLUG_LOG_KEY, item.getSlug()).addKeyValue("backupPath", backupPath)
                    .addKeyValue("errorCode", e.getErrorCode()).setCause(e)
                    .log("Rollback failed, package directory left in failed state");
            return result.backupPath(backupPath.toString())
                    .message(String.format("Rollback of \"%s\" FAILED: %s", item.getDisplayName(), e.getMessage()))
                    .build();
        }
        backupStore.cleanupBackup(backupPath);
        return result.rolledBack(true)
                .message(String.format("Rolled back \"%s\" to version %s.", item.getDisplayName(),
                        Utils.isEmpty(item.getInstalledVersion()) ? "previously installed"
                                : item.getInstalledVersion()))
                .build();
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private void handleActivation(PackageItem item, ProcessResult.ProcessResultBuilder result) {
        String descriptor = item.getEffectiveDescriptor();
        try {
            // an update of an active package keeps it active, activating again would re-run its hooks
            if (item.isUpdate() && activator.isActive(descriptor)) {
                result.activated(true);
                return;
            }
            if (!shouldActivate(item)) {
                return;
            }
            activator.activate(descriptor, item.isNetworkWide());
            result.activated(true).message(String.format("Activated \"%s\".", item.getDisplayName()));
        } catch (ActivationException | RuntimeException e) {
            logger.atWarn().addKeyValue(SLUG_LOG_KEY, item.getSlug()).setCause(e)
                    .log("Package installed but could not be activated");
            result.activated(false).message(String.format("\"%s\" could not be activated: %s",
                    item.getDisplayName(), Utils.getUltimateMessage(e)));
        }
    }
}
