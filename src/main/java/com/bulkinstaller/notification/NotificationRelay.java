/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.notification;

import com.bulkinstaller.notification.models.BatchNotification;
import com.bulkinstaller.notification.models.RollbackNotification;

/**
 * Delivers batch notifications. Delivery is fire-and-forget: callers never see delivery failures.
 */
public interface NotificationRelay {

    NotificationRelay NO_OP = new NotificationRelay() {
        @Override
        public void batchCompleted(BatchNotification notification) {
        }

        @Override
        public void batchRolledBack(RollbackNotification notification) {
        }
    };

    void batchCompleted(BatchNotification notification);

    void batchRolledBack(RollbackNotification notification);
}
