/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.config;

import com.bulkinstaller.errorcode.InstallerErrorCode;
import com.bulkinstaller.packagemanager.exceptions.PackagingException;

public class InvalidConfigurationException extends PackagingException {
    static final long serialVersionUID = -3387516993124229948L;

    public InvalidConfigurationException(String message) {
        super(message, InstallerErrorCode.CONFIG_INVALID);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause, InstallerErrorCode.CONFIG_INVALID);
    }
}
