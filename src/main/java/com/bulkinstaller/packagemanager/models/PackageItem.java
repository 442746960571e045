/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager.models;

import com.bulkinstaller.util.Utils;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * A package selected for installation or update in a batch.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
@ToString
public class PackageItem {

    private String slug;
    private PackageAction action;
    private String name;
    private String targetVersion;
    // only present for updates
    private String installedVersion;
    private String sourcePath;
    private String packageDescriptor;
    // null means the global auto-activate setting applies
    private Boolean activate;
    private boolean networkWide;
    private String requiresRuntime;
    private String requiresPlatform;
    private List<CompatibilityIssue> compatibilityIssues;

    public PackageAction getAction() {
        return action == null ? PackageAction.INSTALL : action;
    }

    public List<CompatibilityIssue> getCompatibilityIssues() {
        return compatibilityIssues == null ? Collections.emptyList() : compatibilityIssues;
    }

    @JsonIgnore
    public String getDisplayName() {
        return Utils.isEmpty(name) ? slug : name;
    }

    /**
     * Installer-addressable handle of the package. Falls back to {@code <slug>/<slug>.php}.
     *
     * @return descriptor
     */
    @JsonIgnore
    public String getEffectiveDescriptor() {
        return Utils.isEmpty(packageDescriptor) ? slug + "/" + slug + ".php" : packageDescriptor;
    }

    @JsonIgnore
    public boolean isUpdate() {
        return getAction() == PackageAction.UPDATE;
    }
}
