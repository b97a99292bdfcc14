package com.profilescheduler.orchestrator.model;

/**
 * Recurrence rule of a recurring schedule.
 *
 * UNRECOGNIZED covers anything the management layer wrote that this
 * engine cannot interpret; it yields no further occurrence.
 */
public enum RecurrencePattern {
    NONE("none"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    UNRECOGNIZED("");

    private final String value;

    RecurrencePattern(String value) {
        this.value = value;
    }

    public String value() { return value; }

    public static RecurrencePattern fromValue(String value) {
        if (value == null || value.isBlank()) return NONE;
        for (RecurrencePattern p : values()) {
            if (p != UNRECOGNIZED && p.value.equalsIgnoreCase(value.trim())) return p;
        }
        return UNRECOGNIZED;
    }
}
