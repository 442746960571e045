/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.notification;

import com.bulkinstaller.notification.models.BatchNotification;
import com.bulkinstaller.notification.models.NotificationMessage;
import com.bulkinstaller.notification.models.RollbackNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the log instead of mailing them.
 */
public class LoggingNotificationRelay implements NotificationRelay {
    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationRelay.class);

    private final NotificationFormatter formatter;

    public LoggingNotificationRelay() {
        this(new NotificationFormatter());
    }

    public LoggingNotificationRelay(NotificationFormatter formatter) {
        this.formatter = formatter;
    }

    @Override
    public void batchCompleted(BatchNotification notification) {
        publish(formatter.formatBatch(notification), notification.getBatchId(), String.join(",",
                notification.getRecipients()));
    }

    @Override
    public void batchRolledBack(RollbackNotification notification) {
        publish(formatter.formatRollback(notification), notification.getBatchId(), String.join(",",
                notification.getRecipients()));
    }

    private void publish(NotificationMessage message, String batchId, String recipients) {
        logger.atInfo().addKeyValue("batchId", batchId).addKeyValue("recipients", recipients)
                .addKeyValue("subject", message.getSubject()).log(message.getBody());
    }
}
