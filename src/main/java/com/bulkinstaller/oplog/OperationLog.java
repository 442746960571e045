/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.oplog;

import java.util.List;

/**
 * Append-only activity log of package operations.
 */
public interface OperationLog {
    int DEFAULT_LIMIT = 50;

    void append(OperationLogEntry entry);

    /**
     * Entries newest first.
     *
     * @param limit  maximum number of entries, negative values count as 0
     * @param offset number of newest entries to skip, negative values count as 0
     * @return entries
     */
    List<OperationLogEntry> getEntries(int limit, int offset);

    default List<OperationLogEntry> getEntries() {
        return getEntries(DEFAULT_LIMIT, 0);
    }

    void clear();

    int size();
}
