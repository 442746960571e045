/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.config;

import com.bulkinstaller.util.Coerce;
import com.bulkinstaller.util.SerializerFactory;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads {@link InstallerConfiguration} from a YAML document. Values that are out of range or malformed are rejected
 * with a warning and the default is kept in their place.
 */
public class ConfigurationLoader {
    public static final String AUTO_ACTIVATE = "autoActivate";
    public static final String AUTO_ROLLBACK = "autoRollback";
    public static final String ROLLBACK_RETENTION_HOURS = "rollbackRetentionHours";
    public static final String MAX_PLUGINS = "maxPlugins";
    public static final String MAX_FILE_SIZE_MB = "maxFileSizeMb";
    public static final String EMAIL_NOTIFICATIONS = "emailNotifications";
    public static final String EMAIL_RECIPIENTS = "emailRecipients";
    public static final String RECORD_BATCHES = "recordBatches";
    public static final String PLUGINS_DIRECTORY = "pluginsDirectory";
    public static final String BACKUP_DIRECTORY = "backupDirectory";
    public static final String STATE_DIRECTORY = "stateDirectory";
    public static final String RUNTIME_VERSION = "runtimeVersion";
    public static final String PLATFORM_VERSION = "platformVersion";

    static final int MAX_PLUGINS_MIN = 1;
    static final int MAX_PLUGINS_MAX = 100;
    static final int RETENTION_MIN = 1;
    static final int RETENTION_MAX = 720;
    static final int FILE_SIZE_MAX = 99_999;

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    private static final String KEY_LOG_KEY = "key";
    private static final String VALUE_LOG_KEY = "value";
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    /**
     * Load configuration from a YAML file. A missing file yields the defaults.
     *
     * @param file path to the YAML file
     * @return configuration
     * @throws InvalidConfigurationException if the file exists but can't be parsed
     */
    public InstallerConfiguration load(Path file) throws InvalidConfigurationException {
        if (!Files.exists(file)) {
            logger.atInfo().addKeyValue("file", file).log("No configuration file found, using defaults");
            return InstallerConfiguration.defaults();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Unable to read configuration file " + file, e);
        }
    }

    /**
     * Load configuration from a YAML stream.
     *
     * @param in YAML input
     * @return configuration
     * @throws InvalidConfigurationException if the document can't be parsed
     */
    public InstallerConfiguration load(InputStream in) throws InvalidConfigurationException {
        Map<String, Object> values;
        try {
            values = SerializerFactory.getFailSafeYamlObjectMapper()
                    .readValue(in, new TypeReference<Map<String, Object>>() {
                    });
        } catch (IOException e) {
            throw new InvalidConfigurationException("Configuration is not valid YAML", e);
        }
        return fromMap(values == null ? Collections.emptyMap() : values);
    }

    /**
     * Build a configuration from loosely typed values.
     *
     * @param values setting name to value
     * @return configuration
     */
    public InstallerConfiguration fromMap(Map<String, Object> values) {
        InstallerConfiguration dflt = InstallerConfiguration.defaults();
        InstallerConfiguration.InstallerConfigurationBuilder builder = InstallerConfiguration.builder();

        if (values.containsKey(AUTO_ACTIVATE)) {
            builder.autoActivate(Coerce.toBoolean(values.get(AUTO_ACTIVATE)));
        }
        if (values.containsKey(AUTO_ROLLBACK)) {
            builder.autoRollback(Coerce.toBoolean(values.get(AUTO_ROLLBACK)));
        }
        if (values.containsKey(EMAIL_NOTIFICATIONS)) {
            builder.emailNotifications(Coerce.toBoolean(values.get(EMAIL_NOTIFICATIONS)));
        }
        if (values.containsKey(RECORD_BATCHES)) {
            builder.recordBatches(Coerce.toBoolean(values.get(RECORD_BATCHES)));
        }
        builder.maxPlugins(intInRange(values, MAX_PLUGINS, MAX_PLUGINS_MIN, MAX_PLUGINS_MAX, dflt.getMaxPlugins()));
        builder.rollbackRetentionHours(intInRange(values, ROLLBACK_RETENTION_HOURS, RETENTION_MIN, RETENTION_MAX,
                dflt.getRollbackRetentionHours()));
        builder.maxFileSizeMb(intInRange(values, MAX_FILE_SIZE_MB, 0, FILE_SIZE_MAX, dflt.getMaxFileSizeMb()));
        builder.emailRecipients(emailRecipients(values.get(EMAIL_RECIPIENTS), dflt.getEmailRecipients()));

        if (values.get(PLUGINS_DIRECTORY) != null) {
            builder.pluginsDirectory(Paths.get(Coerce.toString(values.get(PLUGINS_DIRECTORY))));
        }
        if (values.get(BACKUP_DIRECTORY) != null) {
            builder.backupDirectory(Paths.get(Coerce.toString(values.get(BACKUP_DIRECTORY))));
        }
        if (values.get(STATE_DIRECTORY) != null) {
            builder.stateDirectory(Paths.get(Coerce.toString(values.get(STATE_DIRECTORY))));
        }
        builder.runtimeVersion(Coerce.toString(values.get(RUNTIME_VERSION)));
        builder.platformVersion(Coerce.toString(values.get(PLATFORM_VERSION)));
        return builder.build();
    }

    private static int intInRange(Map<String, Object> values, String key, int min, int max, int dflt) {
        if (!values.containsKey(key)) {
            return dflt;
        }
        Object raw = values.get(key);
        int value = Coerce.toInt(raw, Integer.MIN_VALUE);
        if (value < min || value > max) {
            logger.atWarn().addKeyValue(KEY_LOG_KEY, key).addKeyValue(VALUE_LOG_KEY, raw)
                    .log("Setting must be between {} and {}. Keeping default {}", min, max, dflt);
            return dflt;
        }
        return value;
    }

    private static List<String> emailRecipients(Object raw, List<String> dflt) {
        if (raw == null) {
            return dflt;
        }
        List<String> valid = new ArrayList<>();
        for (String email : Coerce.toStringList(raw)) {
            if (!EMAIL.matcher(email).matches()) {
                logger.atWarn().addKeyValue(KEY_LOG_KEY, EMAIL_RECIPIENTS).addKeyValue(VALUE_LOG_KEY, email)
                        .log("One or more email addresses are invalid. Keeping default recipients");
                return dflt;
            }
            valid.add(email);
        }
        return valid;
    }
}
