/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.testcommons;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds package trees and archives on disk for tests.
 */
public final class PackageFixtures {
    private static final Pattern VERSION = Pattern.compile("Version: (\\S+)");

    private PackageFixtures() {
    }

    /**
     * Create {@code <root>/<slug>/<slug>.php} declaring the given version, plus a nested asset.
     *
     * @param root    directory holding the package directory
     * @param slug    package slug
     * @param version declared version
     * @return package directory
     * @throws IOException on I/O error
     */
    public static Path createPackage(Path root, String slug, String version) throws IOException {
        Path dir = root.resolve(slug);
        Files.createDirectories(dir.resolve("assets"));
        Files.write(dir.resolve(slug + ".php"), mainFile(slug, version).getBytes(StandardCharsets.UTF_8));
        Files.write(dir.resolve("assets").resolve("style.css"), ("/* " + version + " */")
                .getBytes(StandardCharsets.UTF_8));
        return dir;
    }

    public static String readVersion(Path packageDir) throws IOException {
        String slug = packageDir.getFileName().toString();
        String content = new String(Files.readAllBytes(packageDir.resolve(slug + ".php")), StandardCharsets.UTF_8);
        Matcher m = VERSION.matcher(content);
        return m.find() ? m.group(1) : null;
    }

    /**
     * Write a zip holding {@code <slug>/<slug>.php} in a single top-level folder, the usual archive layout.
     *
     * @param zipFile archive to create
     * @param slug    package slug
     * @param version declared version
     * @return the archive
     * @throws IOException on I/O error
     */
    public static Path createArchive(Path zipFile, String slug, String version) throws IOException {
        try (OutputStream os = Files.newOutputStream(zipFile); ZipOutputStream zos = new ZipOutputStream(os)) {
            zos.putNextEntry(new ZipEntry(slug + "/"));
            zos.closeEntry();
            zos.putNextEntry(new ZipEntry(slug + "/" + slug + ".php"));
            zos.write(mainFile(slug, version).getBytes(StandardCharsets.UTF_8));
            zos.closeEntry();
            zos.putNextEntry(new ZipEntry(slug + "/readme.txt"));
            zos.write("readme".getBytes(StandardCharsets.UTF_8));
            zos.closeEntry();
        }
        return zipFile;
    }

    /**
     * Write a zip with a single entry under an arbitrary name.
     *
     * @param zipFile   archive to create
     * @param entryName entry name, may contain {@code ..}
     * @return the archive
     * @throws IOException on I/O error
     */
    public static Path createArchiveWithEntry(Path zipFile, String entryName) throws IOException {
        try (OutputStream os = Files.newOutputStream(zipFile); ZipOutputStream zos = new ZipOutputStream(os)) {
            zos.putNextEntry(new ZipEntry(entryName));
            zos.write("payload".getBytes(StandardCharsets.UTF_8));
            zos.closeEntry();
        }
        return zipFile;
    }

    private static String mainFile(String slug, String version) {
        return "<?php\n/*\n * Plugin Name: " + slug + "\n * Version: " + version + "\n */\n";
    }
}
