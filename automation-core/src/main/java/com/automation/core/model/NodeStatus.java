package com.automation.core.model;

/**
 * Completion status of a hierarchy node. For checklist items COMPLETED means checked.
 */
public enum NodeStatus {
    PENDING,
    COMPLETED
}
