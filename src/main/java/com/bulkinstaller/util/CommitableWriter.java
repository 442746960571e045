/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.util;

import java.io.BufferedOutputStream;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public final class CommitableWriter extends BufferedWriter implements Commitable {
    private final CommitableFile out;
    private boolean open = true;

    private CommitableWriter(CommitableFile f) {
        super(new OutputStreamWriter(new BufferedOutputStream(f), StandardCharsets.UTF_8));
        out = f;
    }

    /**
     * Writer that discards its content unless {@link #commit()} is called. Works well with try-with-resources: a
     * thrown exception leaves the previous file in place.
     *
     * @param p Path to write to
     * @return writer
     * @throws IOException if the file cannot be opened
     */
    public static CommitableWriter abandonOnClose(Path p) throws IOException {
        return new CommitableWriter(CommitableFile.abandonOnClose(p));
    }

    @Override
    public void commit() {
        if (open) {
            try {
                flush();
            } catch (IOException ignore) {
                // CommitableFile.commit flushes again and logs the failure
            }
            out.commit();
            open = false;
        }
    }

    @Override
    public void abandon() {
        if (open) {
            out.abandon();
            open = false;
        }
    }

}
