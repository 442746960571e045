/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager.exceptions;

import com.bulkinstaller.errorcode.InstallerErrorCode;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class RestoreException extends PackagingException {
    static final long serialVersionUID = -3387516993124229948L;

    public RestoreException(String message, InstallerErrorCode errorCode) {
        super(message, errorCode);
    }

    public RestoreException(String message, Throwable cause, InstallerErrorCode errorCode) {
        super(message, cause, errorCode);
    }
}
