/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.notification;

import com.bulkinstaller.notification.models.BatchNotification;
import com.bulkinstaller.notification.models.NotificationMessage;
import com.bulkinstaller.notification.models.RollbackNotification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class LoggingNotificationRelayTest {
    @Mock
    private NotificationFormatter formatter;

    @Test
    void GIVEN_notifications_WHEN_relayed_THEN_rendered_by_formatter() {
        BatchNotification batch = BatchNotification.builder().batchId("b1").recipient("ops@example.com").build();
        RollbackNotification rollback = RollbackNotification.builder().batchId("b1").build();
        doReturn(new NotificationMessage("s", "body")).when(formatter).formatBatch(batch);
        doReturn(new NotificationMessage("s", "body")).when(formatter).formatRollback(rollback);

        LoggingNotificationRelay relay = new LoggingNotificationRelay(formatter);
        relay.batchCompleted(batch);
        relay.batchRolledBack(rollback);

        verify(formatter).formatBatch(batch);
        verify(formatter).formatRollback(rollback);
    }
}
