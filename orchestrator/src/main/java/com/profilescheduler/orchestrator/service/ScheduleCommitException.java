package com.profilescheduler.orchestrator.service;

/**
 * Thrown when a schedule's post-run state cannot be written. The schedule
 * stays claimed until an operator re-arms it.
 */
public class ScheduleCommitException extends RuntimeException {

    public ScheduleCommitException(String message) {
        super(message);
    }

    public ScheduleCommitException(String message, Throwable cause) {
        super(message, cause);
    }
}
