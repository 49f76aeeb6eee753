package com.automation.core.model;

/**
 * How a time-based trigger is scheduled.
 */
public enum ScheduleType {
    /**
     * Recurring, driven by a cron expression.
     */
    CRON("cron"),

    /**
     * Fires once at its next execution time, then disables itself.
     */
    ONE_TIME("one_time");

    private final String wireName;

    ScheduleType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ScheduleType fromWireName(String wireName) {
        for (ScheduleType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown schedule type: " + wireName);
    }
}
