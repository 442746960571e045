/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager;

import com.bulkinstaller.packagemanager.exceptions.ActivationException;

public interface PackageActivator {

    boolean isActive(String descriptor);

    /**
     * Activate an installed package.
     *
     * @param descriptor  installer-addressable handle
     * @param networkWide activate for every tenant instead of the current one
     * @throws ActivationException if the package can't be activated
     */
    void activate(String descriptor, boolean networkWide) throws ActivationException;
}
