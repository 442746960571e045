/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager;

import com.bulkinstaller.packagemanager.exceptions.ActivationException;
import com.bulkinstaller.store.ExpiringStore;
import com.bulkinstaller.store.InMemoryExpiringStore;
import com.bulkinstaller.testcommons.PackageFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StoredPackageActivatorTest {
    @TempDir
    Path root;

    private PackagePaths packagePaths;
    private ExpiringStore<List<String>> store;
    private StoredPackageActivator activator;

    @BeforeEach
    void beforeEach() {
        packagePaths = new PackagePaths(root.resolve("plugins"), root.resolve("backups"), root.resolve("state"));
        store = new InMemoryExpiringStore<>();
        activator = new StoredPackageActivator(store, packagePaths);
    }

    @Test
    void GIVEN_installed_package_WHEN_activate_THEN_active_once() throws Exception {
        PackageFixtures.createPackage(packagePaths.pluginsPath(), "akismet", "5.0");
        assertFalse(activator.isActive("akismet/akismet.php"));

        activator.activate("akismet/akismet.php", false);
        activator.activate("akismet/akismet.php", false);

        assertTrue(activator.isActive("akismet/akismet.php"));
        assertThat(store.get(StoredPackageActivator.ACTIVE_KEY).get(), contains("akismet/akismet.php"));
        assertFalse(store.get(StoredPackageActivator.ACTIVE_SITEWIDE_KEY).isPresent());
    }

    @Test
    void GIVEN_network_wide_WHEN_activate_THEN_sitewide_list() throws Exception {
        PackageFixtures.createPackage(packagePaths.pluginsPath(), "akismet", "5.0");

        activator.activate("akismet/akismet.php", true);

        assertTrue(activator.isActive("akismet/akismet.php"));
        assertThat(store.get(StoredPackageActivator.ACTIVE_SITEWIDE_KEY).get(), contains("akismet/akismet.php"));
    }

    @Test
    void GIVEN_missing_plugin_file_WHEN_activate_THEN_fail() {
        assertThrows(ActivationException.class, () -> activator.activate("ghost/ghost.php", false));
        assertThrows(ActivationException.class, () -> activator.activate("../../etc/passwd", false));
        assertFalse(activator.isActive("ghost/ghost.php"));
    }
}
