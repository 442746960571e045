/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.bulkinstaller.notification.models;

import lombok.Value;

/**
 * Rendered plain-text notification.
 */
@Value
public class NotificationMessage {
    String subject;
    String body;
}
