/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.util;

import org.apache.commons.lang3.SystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.Collection;

@SuppressWarnings({"checkstyle:overloadmethodsdeclarationorder", "PMD.AssignmentInOperand"})
public final class Utils {
    private static final char[] rsChars = "abcdefghjklmnpqrstuvwxyz0123456789".toCharArray();
    private static SecureRandom random;

    private Utils() {
    }

    /**
     * Returns true if the given string is null, empty, or only whitespace.
     *
     * @param s string to check.
     * @return true if it is null, empty, or only whitespace.
     */
    public static boolean isEmpty(String s) {
        if (s == null) {
            return true;
        }
        int len = s.length();
        for (int i = 0; i < len; i++) {
            if (!Character.isSpaceChar(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isNotEmpty(String s) {
        return !isEmpty(s);
    }

    public static boolean isEmpty(Collection<?> s) {
        return s == null || s.isEmpty();
    }

    /**
     * Get the last cause in the chain of causes (the first cause which happened).
     *
     * @param t throwable to get the cause of.
     * @return Throwable the ultimate cause.
     */
    private static Throwable getUltimateCause(Throwable t) {
        while (t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Get the last message from the chain of causes (the message of the first cause which happened).
     *
     * @param t throwable to get the cause of.
     * @return String message.
     */
    public static String getUltimateMessage(Throwable t) {
        if (t == null) {
            return "No Error";
        }
        String msg = getUltimateCause(t).getMessage();
        return isEmpty(msg) ? t.toString() : msg;
    }

    /**
     * Generate a secure random string of a given length.
     *
     * @param desiredLength length of the output string
     * @return the random string
     */
    public static String generateRandomString(int desiredLength) {
        SecureRandom r;
        if ((r = random) == null) {
            r = random = new SecureRandom();
        }
        StringBuilder sb = new StringBuilder(desiredLength);
        byte[] srb = new byte[desiredLength];
        r.nextBytes(srb);
        while (--desiredLength >= 0) {
            sb.append(rsChars[srb[desiredLength] & 31]);
        }
        return sb.toString();
    }

    /**
     * Create the given directories (and their parents) when they don't exist yet.
     *
     * @param paths directories to create
     * @throws IOException if a directory cannot be created
     */
    public static void createPaths(Path... paths) throws IOException {
        for (Path p : paths) {
            if (Files.isDirectory(p)) {
                continue;
            }
            if (SystemUtils.IS_OS_WINDOWS) {
                Files.createDirectories(p);
            } else {
                Files.createDirectories(p,
                        PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwxr-xr-x")));
            }
        }
    }

    /**
     * Turn an arbitrary key (a batch id, say) into something safe to use as a file name.
     *
     * @param key key
     * @return file name
     */
    public static String getSafeFileName(String key) {
        return key.replace(':', '.').replace('/', '+').replace('\\', '+');
    }
}
