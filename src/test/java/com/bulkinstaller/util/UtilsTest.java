/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.io.FileMatchers.anExistingDirectory;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UtilsTest {
    @TempDir
    Path temp;

    @Test
    void testIsEmpty() {
        assertTrue(Utils.isEmpty((String) null));
        assertTrue(Utils.isEmpty(""));
        assertTrue(Utils.isEmpty("   "));
        assertFalse(Utils.isEmpty("akismet"));
        assertTrue(Utils.isEmpty(Collections.emptyList()));
        assertFalse(Utils.isEmpty(Collections.singletonList("a")));
    }

    @Test
    void testGenerateRandomString() {
        String first = Utils.generateRandomString(6);
        assertThat(first, matchesPattern("[a-z0-9]{6}"));
        assertNotEquals(first, Utils.generateRandomString(32));
    }

    @Test
    void testUltimateMessage() {
        IOException root = new IOException("disk full");
        assertEquals("disk full", Utils.getUltimateMessage(new IllegalStateException("outer", root)));
        assertEquals("disk full", Utils.getUltimateMessage(new RuntimeException(new RuntimeException(root))));
        assertEquals("No Error", Utils.getUltimateMessage(null));
    }

    @Test
    void testSafeFileName() {
        assertEquals("bpi_batch_1.2+3", Utils.getSafeFileName("bpi_batch_1:2/3"));
    }

    @Test
    void testCreatePaths() throws Exception {
        Path nested = temp.resolve("a").resolve("b").resolve("c");
        Utils.createPaths(nested);
        Utils.createPaths(nested);
        assertThat(nested.toFile(), anExistingDirectory());
    }
}
