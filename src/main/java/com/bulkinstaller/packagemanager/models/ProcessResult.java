/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of processing one {@link PackageItem}.
 */
@Value
@Builder(toBuilder = true)
public class ProcessResult {
    String slug;
    String name;
    PackageAction action;
    ProcessStatus status;
    boolean activated;
    boolean rolledBack;
    boolean dryRun;
    @Singular
    List<String> messages;
    // set for updates whose pre-update backup is still on disk
    String backupPath;
    String fromVersion;
    String toVersion;
    String packageDescriptor;
    @Singular
    List<CompatibilityIssue> compatibilityIssues;

    @JsonIgnore
    public boolean isSuccessful() {
        return status == ProcessStatus.SUCCESS;
    }

    public String joinedMessages() {
        return String.join(" ", messages);
    }
}
