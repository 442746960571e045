/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.errorcode;

import lombok.Getter;

public enum InstallerErrorCode {
    /* Backup store */
    BACKUP_SOURCE_MISSING(InstallerErrorType.REQUEST_ERROR),
    BACKUP_DIR_FAILED(InstallerErrorType.DEVICE_ERROR),
    BACKUP_COPY_FAILED(InstallerErrorType.DEVICE_ERROR),

    /* Restore path */
    RESTORE_BACKUP_MISSING(InstallerErrorType.DEVICE_ERROR),
    RESTORE_DELETE_FAILED(InstallerErrorType.DEVICE_ERROR),
    RESTORE_COPY_FAILED(InstallerErrorType.DEVICE_ERROR),

    /* Collaborators */
    INSTALLER_FAILURE(InstallerErrorType.PACKAGE_ERROR),
    // downgraded to a warning by the item processor
    ACTIVATION_FAILURE(InstallerErrorType.PACKAGE_ERROR),

    /* Batch rollback */
    BATCH_NOT_FOUND(InstallerErrorType.REQUEST_ERROR),
    MISSING_BACKUP_PATH(InstallerErrorType.NONE),

    /* Generic */
    IO_ERROR(InstallerErrorType.DEVICE_ERROR),
    CONFIG_INVALID(InstallerErrorType.REQUEST_ERROR);

    @Getter
    private final InstallerErrorType errorType;

    InstallerErrorCode(InstallerErrorType errorType) {
        this.errorType = errorType;
    }
}
