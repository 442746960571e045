/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.errorcode;

public enum InstallerErrorType {
    NONE,
    DEVICE_ERROR,
    PACKAGE_ERROR,
    REQUEST_ERROR
}
