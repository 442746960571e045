/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

/**
 * Settings of the installer. Passed explicitly to the components that need them; nothing reads settings from a
 * global store.
 */
@Value
@Builder(toBuilder = true)
public class InstallerConfiguration {
    public static final int DEFAULT_RETENTION_HOURS = 24;
    public static final int DEFAULT_MAX_PLUGINS = 20;

    @Builder.Default
    boolean autoActivate = false;
    // gates whether a failed update restores its backup
    @Builder.Default
    boolean autoRollback = true;
    @Builder.Default
    int rollbackRetentionHours = DEFAULT_RETENTION_HOURS;
    @Builder.Default
    int maxPlugins = DEFAULT_MAX_PLUGINS;
    // 0 means no limit of our own
    @Builder.Default
    int maxFileSizeMb = 0;
    @Builder.Default
    boolean emailNotifications = false;
    @Builder.Default
    List<String> emailRecipients = Collections.emptyList();
    @Builder.Default
    boolean recordBatches = true;

    @Builder.Default
    Path pluginsDirectory = Paths.get("wp-content", "plugins");
    @Builder.Default
    Path backupDirectory = Paths.get("wp-content", "bpi-backups");
    @Builder.Default
    Path stateDirectory = Paths.get("wp-content", "bpi-state");

    String runtimeVersion;
    String platformVersion;

    public static InstallerConfiguration defaults() {
        return InstallerConfiguration.builder().build();
    }

    /**
     * Retention used for batch manifests. Non-positive values fall back to {@value #DEFAULT_RETENTION_HOURS} hours.
     *
     * @return retention in hours, always positive
     */
    public int getEffectiveRetentionHours() {
        return rollbackRetentionHours < 1 ? DEFAULT_RETENTION_HOURS : rollbackRetentionHours;
    }

    public long getRetentionSeconds() {
        return getEffectiveRetentionHours() * 3600L;
    }
}
