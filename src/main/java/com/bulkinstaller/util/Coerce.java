/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lenient conversions for values read from loosely typed configuration sources.
 */
public final class Coerce {
    private static final Pattern SEPARATORS = Pattern.compile(" *, *");

    private Coerce() {
    }

    /**
     * Convert the object into a boolean value.
     *
     * @param o object
     * @return result.
     */
    public static boolean toBoolean(Object o) {
        if (o instanceof Boolean) {
            return (Boolean) o;
        }
        if (o instanceof Number) {
            return ((Number) o).intValue() != 0;
        }
        if (o != null) {
            switch (o.toString().trim()) {
                case "true":
                case "yes":
                case "on":
                case "t":
                case "y":
                case "Y":
                case "1":
                    return true;
                default:
                    return false;
            }
        }
        return false;
    }

    /**
     * Get an object as an integer, or the given default if it can't be read as one.
     *
     * @param o    object to convert.
     * @param dflt default value
     * @return resulting int.
     */
    public static int toInt(Object o, int dflt) {
        if (o instanceof Boolean) {
            return (Boolean) o ? 1 : 0;
        }
        if (o instanceof Number) {
            return ((Number) o).intValue();
        }
        if (o != null) {
            try {
                return Integer.parseInt(o.toString().trim());
            } catch (NumberFormatException ignore) {
                return dflt;
            }
        }
        return dflt;
    }

    public static String toString(Object o) {
        return o == null ? null : o.toString();
    }

    /**
     * Convert an object to a list of strings. Strings are split on commas, collections are converted element-wise.
     * Blank elements are dropped.
     *
     * @param o object to convert.
     * @return resulting list, never null.
     */
    public static List<String> toStringList(Object o) {
        if (o == null) {
            return Collections.emptyList();
        }
        List<String> ret = new ArrayList<>();
        if (o instanceof Iterable) {
            for (Object e : (Iterable<?>) o) {
                if (e != null && Utils.isNotEmpty(e.toString())) {
                    ret.add(e.toString().trim());
                }
            }
            return ret;
        }
        for (String s : SEPARATORS.split(o.toString().trim())) {
            if (Utils.isNotEmpty(s)) {
                ret.add(s.trim());
            }
        }
        return ret;
    }
}
