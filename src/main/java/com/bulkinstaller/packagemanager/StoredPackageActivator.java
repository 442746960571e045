/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager;

import com.bulkinstaller.packagemanager.exceptions.ActivationException;
import com.bulkinstaller.store.ExpiringStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps the set of active packages in an {@link ExpiringStore}, one list for the current site and one for
 * network-wide activations.
 */
public class StoredPackageActivator implements PackageActivator {
    static final String ACTIVE_KEY = "active_plugins";
    static final String ACTIVE_SITEWIDE_KEY = "active_sitewide_plugins";

    private static final Logger logger = LoggerFactory.getLogger(StoredPackageActivator.class);

    private final ExpiringStore<List<String>> store;
    private final PackagePaths packagePaths;

    public StoredPackageActivator(ExpiringStore<List<String>> store, PackagePaths packagePaths) {
        this.store = store;
        this.packagePaths = packagePaths;
    }

    @Override
    public boolean isActive(String descriptor) {
        return activeList(ACTIVE_KEY).contains(descriptor) || activeList(ACTIVE_SITEWIDE_KEY).contains(descriptor);
    }

    @Override
    public synchronized void activate(String descriptor, boolean networkWide) throws ActivationException {
        Path pluginFile = packagePaths.pluginsPath().resolve(descriptor).normalize();
        if (!pluginFile.startsWith(packagePaths.pluginsPath().normalize()) || !Files.isRegularFile(pluginFile)) {
            throw new ActivationException(String.format("Plugin file does not exist: %s", descriptor));
        }
        String key = networkWide ? ACTIVE_SITEWIDE_KEY : ACTIVE_KEY;
        List<String> active = new ArrayList<>(activeList(key));
        if (active.contains(descriptor)) {
            return;
        }
        active.add(descriptor);
        try {
            store.put(key, active, null);
        } catch (IOException e) {
            throw new ActivationException("Unable to persist active packages", e);
        }
        logger.atInfo().addKeyValue("descriptor", descriptor).addKeyValue("networkWide", networkWide)
                .log("Activated package");
    }

    private List<String> activeList(String key) {
        try {
            return store.get(key).orElse(Collections.emptyList());
        } catch (IOException e) {
            logger.atWarn().addKeyValue("key", key).setCause(e).log("Unable to read active packages");
            return Collections.emptyList();
        }
    }
}
