package com.automation.engine.persistence;

import com.automation.core.model.Notification;
import com.automation.core.repository.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Keeps notifications in memory, newest last.
 */
public class InMemoryNotificationService implements NotificationService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryNotificationService.class);

    private final List<Notification> notifications = new CopyOnWriteArrayList<>();

    @Override
    public void createNotification(Notification notification) {
        notifications.add(notification);
        log.debug("Notification for {}: {}", notification.userId(), notification.message());
    }

    public List<Notification> getNotifications() {
        return List.copyOf(notifications);
    }

    public List<Notification> getNotificationsFor(String userId) {
        return notifications.stream().filter(n -> userId.equals(n.userId())).collect(Collectors.toList());
    }
}
