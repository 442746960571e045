/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One reason a package cannot be installed in the current environment.
 */
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
@ToString
public class CompatibilityIssue {
    public static final String TYPE_RUNTIME_VERSION = "runtime_version";
    public static final String TYPE_PLATFORM_VERSION = "platform_version";
    public static final String TYPE_SLUG_CONFLICT = "slug_conflict";

    private String type;
    private String required;
    private String current;
    private String message;
}
