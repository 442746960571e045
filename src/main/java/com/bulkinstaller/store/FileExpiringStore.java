/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.store;

import com.bulkinstaller.util.CommitableFile;
import com.bulkinstaller.util.CommitableReader;
import com.bulkinstaller.util.CommitableWriter;
import com.bulkinstaller.util.SerializerFactory;
import com.bulkinstaller.util.Utils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Expiring store keeping one JSON document per key in a directory. Writes are atomic: a crash while writing leaves
 * the previous version of the entry readable.
 *
 * @param <V> value type
 */
public class FileExpiringStore<V> implements ExpiringStore<V> {
    static final String FILE_SUFFIX = ".json";
    static final String KEY_FIELD = "key";
    static final String EXPIRES_AT_FIELD = "expiresAt";
    static final String VALUE_FIELD = "value";

    private static final Logger logger = LoggerFactory.getLogger(FileExpiringStore.class);
    private static final String FILE_LOG_KEY = "file";

    private final Path directory;
    private final JavaType valueType;
    private final Clock clock;
    private final ObjectMapper mapper = SerializerFactory.getFailSafeJsonObjectMapper();

    /**
     * Constructor.
     *
     * @param directory directory holding the entries; created on first write
     * @param valueType type of the stored values
     * @param clock     clock deciding expiry
     */
    public FileExpiringStore(Path directory, JavaType valueType, Clock clock) {
        this.directory = directory;
        this.valueType = valueType;
        this.clock = clock;
    }

    public static <V> FileExpiringStore<V> of(Path directory, Class<V> valueType, Clock clock) {
        return new FileExpiringStore<>(directory,
                SerializerFactory.getFailSafeJsonObjectMapper().getTypeFactory().constructType(valueType), clock);
    }

    public static <V> FileExpiringStore<V> of(Path directory, TypeReference<V> valueType, Clock clock) {
        return new FileExpiringStore<>(directory,
                SerializerFactory.getFailSafeJsonObjectMapper().getTypeFactory().constructType(valueType), clock);
    }

    @Override
    public synchronized void put(String key, V value, Duration ttl) throws IOException {
        Utils.createPaths(directory);
        ObjectNode record = mapper.createObjectNode();
        record.put(KEY_FIELD, key);
        record.put(EXPIRES_AT_FIELD, ttl == null ? 0 : clock.millis() + ttl.toMillis());
        record.set(VALUE_FIELD, mapper.valueToTree(value));
        Path file = resolve(key);
        String content = mapper.writeValueAsString(record);
        try (CommitableWriter out = CommitableWriter.abandonOnClose(file)) {
            out.write(content);
            out.commit();
        }
        logger.atDebug().addKeyValue(FILE_LOG_KEY, file).addKeyValue(KEY_FIELD, key).log("Persisted entry");
    }

    @Override
    public synchronized Optional<V> get(String key) throws IOException {
        Path file = resolve(key);
        if (!Files.exists(file) && !Files.exists(CommitableFile.getBackupFile(file))) {
            return Optional.empty();
        }
        JsonNode record = readRecord(file);
        if (isExpired(record)) {
            deleteEntry(file);
            return Optional.empty();
        }
        JsonNode value = record.get(VALUE_FIELD);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(mapper.convertValue(value, valueType));
    }

    @Override
    public synchronized void remove(String key) throws IOException {
        deleteEntry(resolve(key));
    }

    @Override
    public synchronized List<String> keys() throws IOException {
        List<String> keys = new ArrayList<>();
        for (Path file : entryFiles()) {
            try {
                JsonNode record = readRecord(file);
                if (record.hasNonNull(KEY_FIELD)) {
                    keys.add(record.get(KEY_FIELD).asText());
                }
            } catch (IOException e) {
                logger.atWarn().addKeyValue(FILE_LOG_KEY, file).setCause(e).log("Ignoring unreadable entry");
            }
        }
        return keys;
    }

    @Override
    public synchronized int purgeExpired() throws IOException {
        int removed = 0;
        for (Path file : entryFiles()) {
            try {
                if (isExpired(readRecord(file))) {
                    deleteEntry(file);
                    removed++;
                }
            } catch (IOException e) {
                logger.atWarn().addKeyValue(FILE_LOG_KEY, file).setCause(e).log("Ignoring unreadable entry");
            }
        }
        return removed;
    }

    Path resolve(String key) {
        return directory.resolve(Utils.getSafeFileName(key) + FILE_SUFFIX);
    }

    private boolean isExpired(JsonNode record) {
        long expiresAt = record.path(EXPIRES_AT_FIELD).asLong(0);
        return expiresAt > 0 && clock.millis() >= expiresAt;
    }

    private JsonNode readRecord(Path file) throws IOException {
        return CommitableReader.of(file).read(in -> {
            JsonNode node = mapper.readTree(in);
            if (node == null || !node.isObject()) {
                throw new IOException("Entry is not a JSON object: " + file);
            }
            return node;
        });
    }

    private void deleteEntry(Path file) throws IOException {
        Files.deleteIfExists(file);
        Files.deleteIfExists(CommitableFile.getBackupFile(file));
    }

    private List<Path> entryFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (Path p : stream) {
                files.add(p);
            }
        }
        return files;
    }
}
