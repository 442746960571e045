/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.batch.model;

import com.bulkinstaller.packagemanager.models.ProcessStatus;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class RollbackEntry {
    String slug;
    RollbackAction action;
    ProcessStatus status;
    String message;
}
