/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.notification;

import com.bulkinstaller.batch.model.BatchSummary;
import com.bulkinstaller.batch.model.RollbackEntry;
import com.bulkinstaller.notification.models.BatchNotification;
import com.bulkinstaller.notification.models.NotificationMessage;
import com.bulkinstaller.notification.models.RollbackNotification;
import com.bulkinstaller.packagemanager.models.ProcessResult;
import com.bulkinstaller.util.Utils;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Renders notifications as plain text.
 */
public class NotificationFormatter {
    public static final String BATCH_SUBJECT = "Bulk Plugin Installer: Batch Complete";
    public static final String ROLLBACK_SUBJECT = "Bulk Plugin Installer: Batch Rollback";

    private static final String SEPARATOR = StringUtils.repeat('-', 40);
    private static final String UNKNOWN = "Unknown";
    private static final String NEWLINE = "\n";

    /**
     * Render the notification of a finished batch.
     *
     * @param notification batch notification
     * @return subject and body
     */
    public NotificationMessage formatBatch(BatchNotification notification) {
        StringBuilder body = new StringBuilder();
        appendHeader(body, notification.getTimestamp(), notification.getUserId());
        body.append(NEWLINE).append("Plugins Processed:").append(NEWLINE).append(SEPARATOR).append(NEWLINE);
        for (ProcessResult result : notification.getResults()) {
            body.append(String.format("- %s (%s): %s", displayName(result.getName(), result.getSlug()),
                    result.getAction(), result.getStatus())).append(NEWLINE);
        }

        BatchSummary summary = notification.getSummary() == null ? BatchSummary.of(notification.getResults())
                : notification.getSummary();
        body.append(NEWLINE).append("Summary:").append(NEWLINE)
                .append("Total: ").append(summary.getTotal()).append(NEWLINE)
                .append("Installed: ").append(summary.getInstalled()).append(NEWLINE)
                .append("Updated: ").append(summary.getUpdated()).append(NEWLINE)
                .append("Failed: ").append(summary.getFailed()).append(NEWLINE)
                .append("Incompatible: ").append(summary.getIncompatible()).append(NEWLINE)
                .append("Rolled back: ").append(summary.getRolledBack()).append(NEWLINE);
        return new NotificationMessage(BATCH_SUBJECT, body.toString());
    }

    /**
     * Render the notification of a batch rollback.
     *
     * @param notification rollback notification
     * @return subject and body
     */
    public NotificationMessage formatRollback(RollbackNotification notification) {
        StringBuilder body = new StringBuilder();
        appendHeader(body, notification.getTimestamp(), notification.getUserId());
        if (Utils.isNotEmpty(notification.getBatchId())) {
            body.append("Batch ID: ").append(notification.getBatchId()).append(NEWLINE);
        }
        if (Utils.isNotEmpty(notification.getReason())) {
            body.append("Reason: ").append(notification.getReason()).append(NEWLINE);
        }
        body.append(NEWLINE).append("Plugins Rolled Back:").append(NEWLINE).append(SEPARATOR).append(NEWLINE);
        for (RollbackEntry entry : notification.getEntries()) {
            body.append(String.format("- %s (%s): %s", displayName(null, entry.getSlug()), entry.getAction(),
                    entry.getStatus())).append(NEWLINE);
        }
        return new NotificationMessage(ROLLBACK_SUBJECT, body.toString());
    }

    /**
     * One-line notice shown to the user after a batch.
     *
     * @param summary batch summary
     * @return notice
     */
    public String adminNotice(BatchSummary summary) {
        return String.format("Bulk operation complete: %d packages processed (%d succeeded, %d failed).",
                summary.getTotal(), summary.getSucceeded(), summary.getFailed());
    }

    private static void appendHeader(StringBuilder body, long timestamp, Long userId) {
        body.append("Timestamp: ").append(DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(timestamp)))
                .append(NEWLINE)
                .append("Admin User: ").append(userId == null ? UNKNOWN : userId.toString()).append(NEWLINE);
    }

    private static String displayName(String name, String slug) {
        if (Utils.isNotEmpty(name)) {
            return name;
        }
        return Utils.isEmpty(slug) ? UNKNOWN : slug;
    }
}
