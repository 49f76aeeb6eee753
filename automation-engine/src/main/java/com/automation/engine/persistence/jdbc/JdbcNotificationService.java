package com.automation.engine.persistence.jdbc;

import com.automation.core.model.Notification;
import com.automation.core.repository.NotificationService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores notifications in the notifications table for the host application to deliver.
 */
@Repository("jdbcNotificationService")
public class JdbcNotificationService implements NotificationService {

    private static final Logger log = LoggerFactory.getLogger(JdbcNotificationService.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcNotificationService(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void createNotification(Notification notification) {
        String sql = """
            INSERT INTO notifications (user_id, title, message, type, metadata_json)
            VALUES (?, ?, ?, ?, ?::jsonb)
            """;
        
        jdbcTemplate.update(sql,
            notification.userId(),
            notification.title(),
            notification.message(),
            notification.type(),
            toJson(notification)
        );
        log.debug("Stored notification for {}", notification.userId());
    }

    private String toJson(Notification notification) {
        try {
            return objectMapper.writeValueAsString(notification.metadata());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize notification metadata", e);
        }
    }
}
