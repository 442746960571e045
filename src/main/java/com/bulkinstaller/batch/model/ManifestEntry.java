/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.batch.model;

import com.bulkinstaller.packagemanager.models.PackageAction;
import com.bulkinstaller.packagemanager.models.ProcessResult;
import com.bulkinstaller.packagemanager.models.ProcessStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One package row of a {@link BatchManifest}.
 */
@Value
@Builder
@Jacksonized
public class ManifestEntry {
    String slug;
    String name;
    PackageAction action;
    String previousVersion;
    String newVersion;
    // only ever set for updates
    String backupPath;
    ProcessStatus status;
    String packageDescriptor;
    boolean activated;

    /**
     * Build the manifest row of a processed item.
     *
     * @param result result of the item
     * @return manifest row
     */
    public static ManifestEntry from(ProcessResult result) {
        return ManifestEntry.builder()
                .slug(result.getSlug())
                .name(result.getName())
                .action(result.getAction())
                .previousVersion(result.getFromVersion())
                .newVersion(result.getToVersion())
                .backupPath(result.getAction() == PackageAction.UPDATE ? result.getBackupPath() : null)
                .status(result.getStatus())
                .packageDescriptor(result.getPackageDescriptor())
                .activated(result.isActivated())
                .build();
    }
}
