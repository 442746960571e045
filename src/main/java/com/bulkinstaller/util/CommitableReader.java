/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a file written through {@link CommitableWriter}, falling back to the previous committed version when the
 * current one can't be parsed.
 */
public final class CommitableReader {
    private static final Logger logger = LoggerFactory.getLogger(CommitableReader.class);

    private final Path target;
    private final Path backup;

    private CommitableReader(Path target, Path backup) {
        this.target = target;
        this.backup = backup;
    }

    public static CommitableReader of(Path path) {
        return new CommitableReader(path, CommitableFile.getBackupFile(path));
    }

    /**
     * Parse the file. When parsing fails and a backup exists, the backup is parsed instead and, if that works,
     * restored as the current version.
     *
     * @param parser reads and validates the content, throwing {@link IOException} if it is unusable
     * @param <T>    parsed type
     * @return parsed content
     * @throws IOException if neither the file nor its backup can be parsed
     */
    public <T> T read(ContentParser<T> parser) throws IOException {
        try (InputStream in = Files.newInputStream(target)) {
            return parser.parse(in);
        } catch (IOException current) {
            if (!Files.exists(backup)) {
                throw current;
            }
            logger.atWarn().addKeyValue("file", target).addKeyValue("backup", backup).setCause(current)
                    .log("Unreadable file, reading backup instead");
            T parsed;
            try (InputStream in = Files.newInputStream(backup)) {
                parsed = parser.parse(in);
            } catch (IOException previous) {
                current.addSuppressed(previous);
                throw current;
            }
            CommitableFile.move(backup, target);
            logger.atDebug().addKeyValue("file", target).log("Reverted file to backup version");
            return parsed;
        }
    }

    @FunctionalInterface
    public interface ContentParser<T> {
        T parse(InputStream in) throws IOException;
    }
}
