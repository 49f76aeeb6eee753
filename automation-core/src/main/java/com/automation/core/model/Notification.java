package com.automation.core.model;

import java.util.Map;

/**
 * In-app notification addressed to a user.
 */
public record Notification(
    String userId,
    String title,
    String message,
    String type,
    Map<String, Object> metadata
) {
    public static final String TYPE_INFO = "info";

    public Notification {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static Notification info(String userId, String title, String message, Map<String, Object> metadata) {
        return new Notification(userId, title, message, TYPE_INFO, metadata);
    }
}
