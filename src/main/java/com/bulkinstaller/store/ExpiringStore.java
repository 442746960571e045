/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.store;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key-value store with a per-key expiry. Expired entries are never returned; {@link #purgeExpired()} removes them
 * eagerly.
 *
 * @param <V> value type
 */
public interface ExpiringStore<V> {

    /**
     * Store a value.
     *
     * @param key   key
     * @param value value
     * @param ttl   time to live, or null to keep the value until it is removed
     * @throws IOException if the value can't be persisted
     */
    void put(String key, V value, Duration ttl) throws IOException;

    Optional<V> get(String key) throws IOException;

    void remove(String key) throws IOException;

    /**
     * Keys of all entries, expired or not.
     *
     * @return keys
     * @throws IOException on I/O error
     */
    List<String> keys() throws IOException;

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     * @throws IOException on I/O error
     */
    int purgeExpired() throws IOException;
}
