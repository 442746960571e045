/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager;

import com.bulkinstaller.config.InstallerConfiguration;
import lombok.AllArgsConstructor;

import java.nio.file.Path;

/**
 * Resolves the on-disk locations used by package operations.
 */
@AllArgsConstructor
@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class PackagePaths {
    static final String MANIFEST_DIRECTORY = "batches";
    static final String ACTIVATION_DIRECTORY = "activation";
    static final String OPERATION_LOG_FILE = "operations.log";

    private final Path pluginsPath;
    private final Path backupPath;
    private final Path statePath;

    public PackagePaths(InstallerConfiguration configuration) {
        this(configuration.getPluginsDirectory(), configuration.getBackupDirectory(),
                configuration.getStateDirectory());
    }

    public Path pluginsPath() {
        return pluginsPath;
    }

    /**
     * Install directory of a package.
     *
     * @param slug package slug, a single path segment
     * @return install directory
     * @throws IllegalArgumentException if the slug would resolve outside the plugins directory
     */
    public Path installPath(String slug) {
        Path p = pluginsPath.resolve(slug).normalize();
        Path parent = p.getParent();
        if (parent == null || !parent.equals(pluginsPath.normalize())) {
            throw new IllegalArgumentException("Package slug must be a single directory name: " + slug);
        }
        return p;
    }

    public Path backupPath() {
        return backupPath;
    }

    public Path statePath() {
        return statePath;
    }

    public Path manifestPath() {
        return statePath.resolve(MANIFEST_DIRECTORY);
    }

    public Path activationPath() {
        return statePath.resolve(ACTIVATION_DIRECTORY);
    }

    public Path operationLogPath() {
        return statePath.resolve(OPERATION_LOG_FILE);
    }
}
