/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.store;

import lombok.AllArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryExpiringStore<V> implements ExpiringStore<V> {
    private final Map<String, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryExpiringStore() {
        this(Clock.systemUTC());
    }

    public InMemoryExpiringStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void put(String key, V value, Duration ttl) {
        long expiresAt = ttl == null ? 0 : clock.millis() + ttl.toMillis();
        entries.put(key, new Entry<>(value, expiresAt));
    }

    @Override
    public Optional<V> get(String key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.value);
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }

    @Override
    public List<String> keys() {
        return new ArrayList<>(entries.keySet());
    }

    @Override
    public int purgeExpired() {
        long now = clock.millis();
        int removed = 0;
        Iterator<Entry<V>> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @AllArgsConstructor
    private static final class Entry<V> {
        private final V value;
        private final long expiresAt;

        boolean isExpired(long now) {
            return expiresAt > 0 && now >= expiresAt;
        }
    }
}
