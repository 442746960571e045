/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager.exceptions;

import com.bulkinstaller.errorcode.InstallerErrorCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

// root class for package operation failures hosting error codes
@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class PackagingException extends Exception {
    static final long serialVersionUID = -3387516993124229948L;

    @Getter
    protected final List<InstallerErrorCode> errorCodes = new ArrayList<>();

    public PackagingException(String message) {
        super(message);
    }

    public PackagingException(String message, Throwable cause) {
        super(message, cause);
    }

    public PackagingException(String message, InstallerErrorCode errorCode) {
        super(message);
        addErrorCode(errorCode);
    }

    public PackagingException(String message, Throwable cause, InstallerErrorCode errorCode) {
        super(message, cause);
        addErrorCode(errorCode);
    }

    public boolean hasErrorCode(InstallerErrorCode errorCode) {
        return errorCodes.contains(errorCode);
    }

    /**
     * The most specific error code attached to this exception.
     *
     * @return last added error code, or null if none
     */
    public InstallerErrorCode getErrorCode() {
        return errorCodes.isEmpty() ? null : errorCodes.get(errorCodes.size() - 1);
    }

    protected final void addErrorCode(InstallerErrorCode errorCode) {
        errorCodes.add(errorCode);
    }
}
