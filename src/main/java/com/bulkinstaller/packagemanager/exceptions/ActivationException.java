/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager.exceptions;

import static com.bulkinstaller.errorcode.InstallerErrorCode.ACTIVATION_FAILURE;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class ActivationException extends PackagingException {
    static final long serialVersionUID = -3387516993124229948L;

    public ActivationException(String message) {
        super(message, ACTIVATION_FAILURE);
    }

    public ActivationException(String message, Throwable cause) {
        super(message, cause, ACTIVATION_FAILURE);
    }
}
