/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Output stream to a file that only replaces the target once committed. If it is abandoned, or the process exits
 * before the commit, the previous version of the file stays in place. The replaced version is kept next to the
 * target with a {@code ~} suffix so that readers can fall back to it.
 */
public final class CommitableFile extends OutputStream implements Commitable {
    private static final Logger logger = LoggerFactory.getLogger(CommitableFile.class);
    private static final String FILE_LOG_KEY = "file";

    private final Path target;
    private final Path pending;
    private final OutputStream out;
    private boolean closed;

    private CommitableFile(Path target) throws IOException {
        super();
        this.target = target;
        this.pending = getNewFile(target);
        Files.deleteIfExists(pending);
        Path parent = pending.getParent();
        if (parent != null) {
            Utils.createPaths(parent);
        }
        out = Files.newOutputStream(pending, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC);
    }

    /**
     * Open a pending version of the target, creating the parent directory if needed. Closing without
     * {@link #commit()} discards it.
     *
     * @param target file to replace on commit
     * @return commitable file
     * @throws IOException if the pending file can't be created
     */
    public static CommitableFile abandonOnClose(Path target) throws IOException {
        return new CommitableFile(target);
    }

    public static Path getNewFile(Path path) {
        return path.resolveSibling(path.getFileName() + "+");
    }

    public static Path getBackupFile(Path path) {
        return path.resolveSibling(path.getFileName() + "~");
    }

    @Override
    public void close() {
        abandon();
    }

    @Override
    public void abandon() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            out.close();
            Files.deleteIfExists(pending);
        } catch (IOException e) {
            logger.atWarn().addKeyValue(FILE_LOG_KEY, pending).setCause(e).log("Unable to discard pending file");
        }
    }

    /**
     * Close the pending version and swap it in. The replaced version becomes the backup.
     */
    @Override
    public void commit() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            out.flush();
            out.close();
        } catch (IOException e) {
            logger.atWarn().addKeyValue(FILE_LOG_KEY, pending).setCause(e).log("Unable to flush pending file");
        }
        if (Files.exists(pending)) {
            move(target, getBackupFile(target));
            move(pending, target);
        }
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        out.write(b, off, len);
    }

    @Override
    public void write(int b) throws IOException {
        out.write(b);
    }

    @Override
    public void flush() throws IOException {
        out.flush();
    }

    static void move(Path from, Path to) {
        try {
            if (Files.exists(from)) {
                Files.move(from, to, ATOMIC_MOVE);
            }
        } catch (IOException e) {
            logger.atError().addKeyValue("from", from).addKeyValue("to", to).setCause(e).log("Unable to move file");
        }
    }
}
