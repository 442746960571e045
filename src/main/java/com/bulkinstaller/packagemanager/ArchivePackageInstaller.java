/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.packagemanager;

import com.bulkinstaller.packagemanager.exceptions.InstallerException;
import com.bulkinstaller.util.Utils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Installs packages from a zip archive or an unpacked directory into the plugins directory.
 *
 * <p>Content is staged next to the plugins directory first and moved into place afterwards, so a broken archive
 * never leaves a half-written package behind. An archive whose content sits in a single top-level folder is
 * flattened into the install directory.</p>
 */
public class ArchivePackageInstaller implements PackageInstaller {
    private static final Logger logger = LoggerFactory.getLogger(ArchivePackageInstaller.class);
    private static final String STAGING_PREFIX = ".staging_";
    private static final String ZIP_EXTENSION = ".zip";

    private final PackagePaths packagePaths;

    public ArchivePackageInstaller(PackagePaths packagePaths) {
        this.packagePaths = packagePaths;
    }

    @Override
    public void install(Path source, String descriptor) throws InstallerException {
        Path installDir = installDirOf(descriptor);
        if (Files.exists(installDir)) {
            throw new InstallerException(String.format("Destination folder already exists: %s", installDir));
        }
        deploy(source, installDir, false);
    }

    @Override
    public void update(Path source, String descriptor) throws InstallerException {
        Path installDir = installDirOf(descriptor);
        if (!Files.isDirectory(installDir)) {
            throw new InstallerException(String.format("Package is not installed: %s", installDir));
        }
        deploy(source, installDir, true);
    }

    private void deploy(Path source, Path installDir, boolean replace) throws InstallerException {
        if (source == null || !Files.exists(source)) {
            throw new InstallerException(String.format("Package source not found: %s", source));
        }
        Path staging = packagePaths.pluginsPath().resolve(STAGING_PREFIX + installDir.getFileName() + "_"
                + Utils.generateRandomString(BackupStore.SUFFIX_LENGTH));
        try {
            Utils.createPaths(staging);
            if (Files.isDirectory(source)) {
                FileUtils.copyDirectory(source.toFile(), staging.toFile());
            } else if (source.getFileName().toString().toLowerCase().endsWith(ZIP_EXTENSION)) {
                unzip(source.toFile(), staging.toFile());
            } else {
                throw new InstallerException(String.format("Unsupported package source: %s", source));
            }

            Path content = packageRoot(staging);
            if (isEmptyDirectory(content)) {
                throw new InstallerException("The package could not be installed. No valid plugins were found.");
            }
            if (replace) {
                FileUtils.forceDelete(installDir.toFile());
            }
            FileUtils.moveDirectory(content.toFile(), installDir.toFile());
            logger.atInfo().addKeyValue("source", source).addKeyValue("installDir", installDir)
                    .log("Deployed package content");
        } catch (IOException e) {
            throw new InstallerException(Utils.getUltimateMessage(e), e);
        } finally {
            FileUtils.deleteQuietly(staging.toFile());
        }
    }

    private Path installDirOf(String descriptor) throws InstallerException {
        if (Utils.isEmpty(descriptor)) {
            throw new InstallerException("Missing package descriptor.");
        }
        String slug = descriptor.split("/", 2)[0];
        try {
            return packagePaths.installPath(slug);
        } catch (IllegalArgumentException e) {
            throw new InstallerException(e.getMessage(), e);
        }
    }

    // archives usually wrap everything in one folder named after the package
    private static Path packageRoot(Path staging) throws IOException {
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(staging)) {
            for (Path p : stream) {
                children.add(p);
            }
        }
        if (children.size() == 1 && Files.isDirectory(children.get(0))) {
            return children.get(0);
        }
        return staging;
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            return !stream.iterator().hasNext();
        }
    }

    @SuppressFBWarnings(value = "NP_NULL_ON_SOME_PATH_FROM_RETURN_VALUE",
            justification = "Entries are resolved under destDir so they always have a parent")
    static void unzip(File zipFile, File destDir) throws IOException {
        try (ZipFile zf = new ZipFile(zipFile)) {
            Enumeration<? extends ZipEntry> entries = zf.entries();
            byte[] buffer = new byte[1024 * 64];

            while (entries.hasMoreElements()) {
                ZipEntry zipEntry = entries.nextElement();
                File newFile = safeNewZipFile(destDir, zipEntry);
                if (zipEntry.isDirectory()) {
                    Utils.createPaths(newFile.toPath());
                } else {
                    Utils.createPaths(newFile.getParentFile().toPath());
                    try (FileChannel fc = FileChannel.open(newFile.toPath(), StandardOpenOption.CREATE,
                            StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
                         InputStream is = zf.getInputStream(zipEntry);
                         OutputStream fos = Channels.newOutputStream(fc)) {
                        IOUtils.copyLarge(is, fos, buffer);
                        fc.force(true);
                    }
                }
            }
        }
    }

    private static File safeNewZipFile(File destinationDir, ZipEntry zipEntry) throws IOException {
        File destFile = new File(destinationDir, zipEntry.getName());

        String destDirPath = destinationDir.getCanonicalPath();
        String destFilePath = destFile.getCanonicalPath();

        if (!destFilePath.startsWith(destDirPath + File.separator)) {
            throw new IOException("Entry is outside of the target dir: " + zipEntry.getName());
        }

        return destFile;
    }
}
