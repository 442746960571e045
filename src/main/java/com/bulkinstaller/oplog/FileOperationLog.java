/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.oplog;

import com.bulkinstaller.util.SerializerFactory;
import com.bulkinstaller.util.Utils;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Activity log stored as JSON lines. Failures to write are logged and swallowed so that logging never fails a
 * package operation.
 */
public class FileOperationLog implements OperationLog {
    private static final Logger logger = LoggerFactory.getLogger(FileOperationLog.class);
    private static final String FILE_LOG_KEY = "file";

    private final Path file;
    private final ObjectMapper mapper = SerializerFactory.getFailSafeJsonObjectMapper();

    public FileOperationLog(Path file) {
        this.file = file;
    }

    @Override
    public synchronized void append(OperationLogEntry entry) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Utils.createPaths(parent);
            }
            String line = mapper.writeValueAsString(entry) + System.lineSeparator();
            Files.write(file, line.getBytes(StandardCharsets.UTF_8), StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
        } catch (IOException e) {
            logger.atError().addKeyValue(FILE_LOG_KEY, file).addKeyValue("action", entry.getAction())
                    .addKeyValue("slug", entry.getSlug()).setCause(e).log("Unable to write activity log entry");
        }
    }

    @Override
    public synchronized List<OperationLogEntry> getEntries(int limit, int offset) {
        List<OperationLogEntry> entries = readAll();
        Collections.reverse(entries);
        return InMemoryOperationLog.page(entries, limit, offset);
    }

    @Override
    public synchronized void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.atError().addKeyValue(FILE_LOG_KEY, file).setCause(e).log("Unable to clear activity log");
        }
    }

    @Override
    public synchronized int size() {
        return readAll().size();
    }

    private List<OperationLogEntry> readAll() {
        List<OperationLogEntry> entries = new ArrayList<>();
        if (!Files.exists(file)) {
            return entries;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.atError().addKeyValue(FILE_LOG_KEY, file).setCause(e).log("Unable to read activity log");
            return entries;
        }
        for (String line : lines) {
            if (Utils.isEmpty(line)) {
                continue;
            }
            try {
                entries.add(mapper.readValue(line, OperationLogEntry.class));
            } catch (IOException e) {
                logger.atWarn().addKeyValue(FILE_LOG_KEY, file).setCause(e).log("Skipping malformed log line");
            }
        }
        return entries;
    }
}
