package com.profilescheduler.orchestrator.model;

/**
 * Whether a schedule fires once or keeps re-arming itself.
 *
 * Stored in the schedules table as the lowercase wire value
 * ("one_shot", "recurring") written by the management UI.
 */
public enum ScheduleType {
    ONE_SHOT("one_shot"),
    RECURRING("recurring");

    private final String value;

    ScheduleType(String value) {
        this.value = value;
    }

    public String value() { return value; }

    /** Unknown or missing values are treated as one-shot so they never re-arm. */
    public static ScheduleType fromValue(String value) {
        if (value != null) {
            for (ScheduleType t : values()) {
                if (t.value.equalsIgnoreCase(value.trim())) return t;
            }
        }
        return ONE_SHOT;
    }
}
