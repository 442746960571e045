/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.batch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;

/**
 * Persisted record of a completed batch, kept until it expires so that the whole batch can be rolled back.
 * Timestamps are epoch milliseconds.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BatchManifest {
    public static final BatchManifest EMPTY = BatchManifest.builder().build();

    String batchId;
    @Builder.Default
    List<ManifestEntry> plugins = Collections.emptyList();
    BatchSummary summary;
    Long userId;
    long createdAt;
    long expiresAt;

    @JsonIgnore
    public boolean isEmpty() {
        return batchId == null;
    }

    @JsonIgnore
    public boolean isExpired(long nowMillis) {
        return expiresAt > 0 && nowMillis > expiresAt;
    }
}
