package com.profilescheduler.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.UUID;

/**
 * A timed "push this profile to these devices" job.
 *
 * Rows are created and edited by the management UI; the engine only reads
 * them and moves last_executed_at / start_time through the claim → commit
 * cycle:
 *
 *   last_executed_at IS NULL      eligible (armed)
 *   last_executed_at IS NOT NULL  claimed, or terminal for one-shot jobs
 *
 * The engine never writes through this entity. All state changes go through
 * the conditional updates in ScheduleRepository.
 *
 * DB table: schedules  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "schedules")
public class Schedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private boolean enabled = true;

    // Raw wire values ("one_shot", "weekly", ...) as written by the UI.
    @Column(name = "schedule_type", nullable = false)
    private String scheduleType;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "recurrence_pattern")
    private String recurrencePattern;

    @Convert(converter = WeekdaySetConverter.class)
    @Column(name = "recurrence_days")
    private Set<Integer> recurrenceDays = Collections.emptySet();

    // JSON blob, parsed by DeviceFilterParser at run time.
    @Column(name = "device_filter", length = 4000)
    private String deviceFilter;

    @Column(name = "profile_id", nullable = false)
    private String profileId;

    @Column(name = "last_executed_at")
    private Instant lastExecutedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Schedule() {}   // required by JPA

    public Schedule(String name, ScheduleType type, Instant startTime, String profileId) {
        this.name         = name;
        this.scheduleType = type.value();
        this.startTime    = startTime;
        this.profileId    = profileId;
    }

    // ------------------------------------------------------------------
    // Derived views
    // ------------------------------------------------------------------

    public ScheduleType getScheduleType() {
        return ScheduleType.fromValue(scheduleType);
    }

    public RecurrencePattern getRecurrencePattern() {
        return RecurrencePattern.fromValue(recurrencePattern);
    }

    public boolean isRecurring() {
        return getScheduleType() == ScheduleType.RECURRING;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID         getId()             { return id; }
    public String       getName()           { return name; }
    public boolean      isEnabled()         { return enabled; }
    public Instant      getStartTime()      { return startTime; }
    public Set<Integer> getRecurrenceDays() { return recurrenceDays; }
    public String       getDeviceFilter()   { return deviceFilter; }
    public String       getProfileId()      { return profileId; }
    public Instant      getLastExecutedAt() { return lastExecutedAt; }
    public Instant      getCreatedAt()      { return createdAt; }
    public Instant      getUpdatedAt()      { return updatedAt; }

    public void setEnabled(boolean enabled)                   { this.enabled = enabled; }
    public void setRecurrencePattern(RecurrencePattern p)     { this.recurrencePattern = p == null ? null : p.value(); }
    public void setRecurrenceDays(Set<Integer> days)          { this.recurrenceDays = days == null ? Collections.emptySet() : days; }
    public void setDeviceFilter(String deviceFilter)          { this.deviceFilter = deviceFilter; }
    public void setLastExecutedAt(Instant lastExecutedAt)     { this.lastExecutedAt = lastExecutedAt; }
}
