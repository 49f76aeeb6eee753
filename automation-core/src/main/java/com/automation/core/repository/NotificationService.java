package com.automation.core.repository;

import com.automation.core.model.Notification;

/**
 * Sink for user notifications.
 */
public interface NotificationService {

    void createNotification(Notification notification);
}
