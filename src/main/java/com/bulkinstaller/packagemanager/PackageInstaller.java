/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager;

import com.bulkinstaller.packagemanager.exceptions.InstallerException;

import java.nio.file.Path;

/**
 * Writes package files into the plugins directory. Implementations own any timeout policy.
 */
public interface PackageInstaller {

    /**
     * Install a package that is not installed yet.
     *
     * @param source     staged archive or directory
     * @param descriptor installer-addressable handle, e.g. {@code akismet/akismet.php}
     * @throws InstallerException if the install fails
     */
    void install(Path source, String descriptor) throws InstallerException;

    /**
     * Replace an installed package with a new version.
     *
     * @param source     staged archive or directory
     * @param descriptor installer-addressable handle of the installed package
     * @throws InstallerException if the update fails
     */
    void update(Path source, String descriptor) throws InstallerException;
}
