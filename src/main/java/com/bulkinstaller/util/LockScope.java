/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.util;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Holds a lock for the duration of a try-with-resources block.
 */
public final class LockScope implements AutoCloseable {
    private final Lock held;

    private LockScope(Lock lock) {
        lock.lock();
        this.held = lock;
    }

    public static LockScope read(ReadWriteLock lock) {
        return new LockScope(lock.readLock());
    }

    public static LockScope write(ReadWriteLock lock) {
        return new LockScope(lock.writeLock());
    }

    @Override
    public void close() {
        held.unlock();
    }
}
