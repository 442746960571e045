/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.oplog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class InMemoryOperationLog implements OperationLog {
    private final List<OperationLogEntry> entries = new ArrayList<>();

    @Override
    public synchronized void append(OperationLogEntry entry) {
        entries.add(entry);
    }

    @Override
    public synchronized List<OperationLogEntry> getEntries(int limit, int offset) {
        List<OperationLogEntry> newestFirst = new ArrayList<>(entries);
        Collections.reverse(newestFirst);
        return page(newestFirst, limit, offset);
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    static List<OperationLogEntry> page(List<OperationLogEntry> newestFirst, int limit, int offset) {
        int from = Math.min(Math.max(offset, 0), newestFirst.size());
        int to = Math.min(from + Math.max(limit, 0), newestFirst.size());
        return new ArrayList<>(newestFirst.subList(from, to));
    }
}
