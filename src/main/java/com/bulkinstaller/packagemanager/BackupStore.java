/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager;

import com.bulkinstaller.packagemanager.exceptions.BackupException;
import com.bulkinstaller.packagemanager.exceptions.RestoreException;
import com.bulkinstaller.util.Utils;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static com.bulkinstaller.errorcode.InstallerErrorCode.BACKUP_COPY_FAILED;
import static com.bulkinstaller.errorcode.InstallerErrorCode.BACKUP_DIR_FAILED;
import static com.bulkinstaller.errorcode.InstallerErrorCode.BACKUP_SOURCE_MISSING;
import static com.bulkinstaller.errorcode.InstallerErrorCode.RESTORE_BACKUP_MISSING;
import static com.bulkinstaller.errorcode.InstallerErrorCode.RESTORE_COPY_FAILED;
import static com.bulkinstaller.errorcode.InstallerErrorCode.RESTORE_DELETE_FAILED;

/**
 * Takes and restores copies of installed package directories.
 *
 * <p>{@link #createBackup} and {@link #restoreBackup} fail loudly. {@link #cleanupBackup} and
 * {@link #removePartialInstall} are best-effort: they never throw and do nothing when the path is missing.</p>
 */
public class BackupStore {
    static final int SUFFIX_LENGTH = 6;

    private static final Logger logger = LoggerFactory.getLogger(BackupStore.class);
    private static final String INSTALL_DIR_LOG_KEY = "installDir";
    private static final String BACKUP_LOG_KEY = "backupPath";

    private final Path backupRoot;
    private final Clock clock;

    public BackupStore(PackagePaths packagePaths, Clock clock) {
        this.backupRoot = packagePaths.backupPath();
        this.clock = clock;
    }

    /**
     * Copy an installed package directory under the backup root.
     *
     * @param installDir directory to back up
     * @return path of the new backup, named {@code <dir>_<epochSeconds>_<random>}
     * @throws BackupException if the directory is missing or can't be copied
     */
    public Path createBackup(Path installDir) throws BackupException {
        Path source = installDir.normalize();
        if (!Files.isDirectory(source)) {
            throw new BackupException(String.format("Cannot create backup: source directory \"%s\" does not exist.",
                    source), BACKUP_SOURCE_MISSING);
        }

        try {
            Utils.createPaths(backupRoot);
        } catch (IOException e) {
            throw new BackupException("Cannot create backup directory.", e, BACKUP_DIR_FAILED);
        }

        Path backup = backupRoot.resolve(String.format("%s_%d_%s", source.getFileName(),
                clock.instant().getEpochSecond(), Utils.generateRandomString(SUFFIX_LENGTH)));
        try {
            copyTree(source, backup);
        } catch (IOException e) {
            throw new BackupException(String.format("Failed to create backup of \"%s\".", source.getFileName()), e,
                    BACKUP_COPY_FAILED);
        }
        logger.atInfo().addKeyValue(INSTALL_DIR_LOG_KEY, source).addKeyValue(BACKUP_LOG_KEY, backup)
                .log("Created package backup");
        return backup;
    }

    /**
     * Replace an install directory with the content of a backup. The backup itself is left in place.
     *
     * @param backupPath backup to restore
     * @param installDir directory to restore into; created if it doesn't exist
     * @throws RestoreException if the backup is missing, or the install directory can't be replaced
     */
    public void restoreBackup(Path backupPath, Path installDir) throws RestoreException {
        Path backup = backupPath.normalize();
        Path target = installDir.normalize();
        if (!Files.isDirectory(backup)) {
            throw new RestoreException(String.format("Cannot restore: backup directory \"%s\" does not exist.",
                    backup), RESTORE_BACKUP_MISSING);
        }

        if (Files.exists(target)) {
            try {
                deleteTree(target);
            } catch (IOException e) {
                throw new RestoreException(String.format(
                        "Failed to remove current plugin directory \"%s\" during restore.", target), e,
                        RESTORE_DELETE_FAILED);
            }
        }

        try {
            copyTree(backup, target);
        } catch (IOException e) {
            throw new RestoreException("Failed to restore plugin from backup.", e, RESTORE_COPY_FAILED);
        }
        logger.atInfo().addKeyValue(INSTALL_DIR_LOG_KEY, target).addKeyValue(BACKUP_LOG_KEY, backup)
                .log("Restored package from backup");
    }

    /**
     * Delete a backup that is no longer needed.
     *
     * @param backupPath backup to delete
     */
    public void cleanupBackup(Path backupPath) {
        deleteQuietly(backupPath.normalize(), "Unable to clean up backup");
    }

    /**
     * Delete whatever a failed or reverted install left behind.
     *
     * @param installDir install directory
     */
    public void removePartialInstall(Path installDir) {
        deleteQuietly(installDir.normalize(), "Unable to remove partially installed package");
    }

    void copyTree(Path source, Path destination) throws IOException {
        FileUtils.copyDirectory(source.toFile(), destination.toFile());
    }

    void deleteTree(Path path) throws IOException {
        FileUtils.forceDelete(path.toFile());
    }

    private void deleteQuietly(Path path, String failureMessage) {
        if (!Files.exists(path)) {
            return;
        }
        try {
            deleteTree(path);
        } catch (IOException e) {
            logger.atWarn().addKeyValue("path", path).setCause(e).log(failureMessage);
        }
    }
}
