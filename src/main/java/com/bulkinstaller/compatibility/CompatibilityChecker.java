/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.compatibility;

import com.bulkinstaller.config.InstallerConfiguration;
import com.bulkinstaller.packagemanager.models.CompatibilityIssue;
import com.bulkinstaller.packagemanager.models.PackageItem;
import com.bulkinstaller.util.Utils;
import com.vdurmont.semver4j.Semver;
import com.vdurmont.semver4j.SemverException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks queued packages against the runtime and platform versions of the environment, and against each other.
 */
public class CompatibilityChecker {
    private static final Logger logger = LoggerFactory.getLogger(CompatibilityChecker.class);

    private final String runtimeVersion;
    private final String platformVersion;

    /**
     * Constructor.
     *
     * @param runtimeVersion  version of the runtime, null to skip runtime checks
     * @param platformVersion version of the platform, null to skip platform checks
     */
    public CompatibilityChecker(String runtimeVersion, String platformVersion) {
        this.runtimeVersion = runtimeVersion;
        this.platformVersion = platformVersion;
    }

    public CompatibilityChecker(InstallerConfiguration configuration) {
        this(configuration.getRuntimeVersion(), configuration.getPlatformVersion());
    }

    /**
     * Check the version requirements of a single package.
     *
     * @param item package
     * @return issues, empty when the package can be installed
     */
    public List<CompatibilityIssue> checkPackage(PackageItem item) {
        List<CompatibilityIssue> issues = new ArrayList<>();
        String requiresRuntime = item.getRequiresRuntime();
        if (!satisfies(runtimeVersion, requiresRuntime)) {
            issues.add(CompatibilityIssue.builder()
                    .type(CompatibilityIssue.TYPE_RUNTIME_VERSION)
                    .required(requiresRuntime)
                    .current(runtimeVersion)
                    .message(String.format("Requires runtime %s or higher. Current version: %s.", requiresRuntime,
                            runtimeVersion))
                    .build());
        }
        String requiresPlatform = item.getRequiresPlatform();
        if (!satisfies(platformVersion, requiresPlatform)) {
            issues.add(CompatibilityIssue.builder()
                    .type(CompatibilityIssue.TYPE_PLATFORM_VERSION)
                    .required(requiresPlatform)
                    .current(platformVersion)
                    .message(String.format("Requires platform %s or higher. Current version: %s.", requiresPlatform,
                            platformVersion))
                    .build());
        }
        return issues;
    }

    /**
     * Find slugs queued more than once. Such packages would all install to the same directory.
     *
     * @param items queued packages
     * @return conflict issues keyed by slug
     */
    public Map<String, List<CompatibilityIssue>> checkSlugConflicts(List<PackageItem> items) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (PackageItem item : items) {
            if (Utils.isNotEmpty(item.getSlug())) {
                counts.merge(item.getSlug(), 1, Integer::sum);
            }
        }

        Map<String, List<CompatibilityIssue>> conflicts = new LinkedHashMap<>();
        counts.forEach((slug, count) -> {
            if (count > 1) {
                conflicts.put(slug, Collections.singletonList(CompatibilityIssue.builder()
                        .type(CompatibilityIssue.TYPE_SLUG_CONFLICT)
                        .required("")
                        .current("")
                        .message(String.format("Slug conflict: %d plugins would install to the same directory "
                                + "\"%s\".", count, slug))
                        .build()));
            }
        });
        return conflicts;
    }

    /**
     * Check every queued package and return copies carrying their issues.
     *
     * @param items queued packages
     * @return packages in the same order with compatibility issues populated
     */
    public List<PackageItem> checkAll(List<PackageItem> items) {
        Map<String, List<CompatibilityIssue>> conflicts = checkSlugConflicts(items);
        List<PackageItem> checked = new ArrayList<>(items.size());
        for (PackageItem item : items) {
            List<CompatibilityIssue> issues = checkPackage(item);
            issues.addAll(conflicts.getOrDefault(item.getSlug(), Collections.emptyList()));
            checked.add(item.toBuilder().compatibilityIssues(issues).build());
        }
        return checked;
    }

    private static boolean satisfies(String current, String required) {
        if (Utils.isEmpty(required) || Utils.isEmpty(current)) {
            return true;
        }
        try {
            return parse(current).isGreaterThanOrEqualTo(parse(required));
        } catch (SemverException e) {
            logger.atWarn().addKeyValue("current", current).addKeyValue("required", required).setCause(e)
                    .log("Unable to compare versions, treating requirement as met");
            return true;
        }
    }

    /**
     * Parse a loose version with missing minor and patch numbers read as zero, so that 6.4 and 6.4.0 compare equal.
     */
    private static Semver parse(String version) {
        String trimmed = version.trim();
        int suffixAt = StringUtils.indexOfAny(trimmed, '-', '+');
        String core = suffixAt < 0 ? trimmed : trimmed.substring(0, suffixAt);
        String suffix = suffixAt < 0 ? "" : trimmed.substring(suffixAt);
        StringBuilder padded = new StringBuilder(core);
        for (int parts = StringUtils.countMatches(core, '.') + 1; parts < 3; parts++) {
            padded.append(".0");
        }
        return new Semver(padded.append(suffix).toString(), Semver.SemverType.LOOSE);
    }
}
