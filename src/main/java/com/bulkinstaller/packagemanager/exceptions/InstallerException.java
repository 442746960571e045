/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager.exceptions;

import static com.bulkinstaller.errorcode.InstallerErrorCode.INSTALLER_FAILURE;

/**
 * Opaque failure reported by a {@link com.bulkinstaller.packagemanager.PackageInstaller}.
 */
@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class InstallerException extends PackagingException {
    static final long serialVersionUID = -3387516993124229948L;

    public InstallerException(String message) {
        super(message, INSTALLER_FAILURE);
    }

    public InstallerException(String message, Throwable cause) {
        super(message, cause, INSTALLER_FAILURE);
    }
}
