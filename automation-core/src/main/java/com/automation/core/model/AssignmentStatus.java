package com.automation.core.model;

/**
 * Lifecycle of a workflow assignment.
 */
public enum AssignmentStatus {
    ACTIVE,
    COMPLETED
}
