/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

public final class SerializerFactory {

    // manifests and log lines written by older builds may carry fields we no longer know about
    private static final ObjectMapper FAIL_SAFE_JSON_OBJECT_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_INVALID_SUBTYPE, false)
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final ObjectMapper FAIL_SAFE_YAML_OBJECT_MAPPER =
            YAMLMapper.builder().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false).build();

    public static ObjectMapper getFailSafeJsonObjectMapper() {
        return FAIL_SAFE_JSON_OBJECT_MAPPER;
    }

    public static ObjectMapper getFailSafeYamlObjectMapper() {
        return FAIL_SAFE_YAML_OBJECT_MAPPER;
    }

    private SerializerFactory() {
    }
}
