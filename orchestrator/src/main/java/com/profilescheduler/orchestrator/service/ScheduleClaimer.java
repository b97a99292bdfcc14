package com.profilescheduler.orchestrator.service;

import com.profilescheduler.orchestrator.model.Schedule;
import com.profilescheduler.orchestrator.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

/**
 * Claims due schedules and commits their state after the run.
 *
 * The claim is a single conditional UPDATE (last_executed_at IS NULL and
 * start_time as scanned → marker). Two overlapping runs that both selected the same schedule race
 * on that row; the database lets exactly one of them win.
 *
 * Commit rules:
 *   one-shot                        stays claimed forever (terminal)
 *   recurring, next time computable start_time = next, marker cleared
 *   recurring, no next time         stays claimed (terminal)
 */
@Service
public class ScheduleClaimer {

    private static final Logger log = LoggerFactory.getLogger(ScheduleClaimer.class);

    public enum Claim { CLAIMED, ALREADY_CLAIMED }

    public enum Commit { REARMED, TERMINAL }

    private final ScheduleRepository scheduleRepo;

    public ScheduleClaimer(ScheduleRepository scheduleRepo) {
        this.scheduleRepo = scheduleRepo;
    }

    /**
     * Claim marker for a run started at now. Truncated to milliseconds so the
     * value read back from the database compares equal in {@link #commit}.
     */
    public static Instant markerFor(Instant now) {
        return now.truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Claim the occurrence starting at expectedStart. Loses if another run
     * claimed it, or already ran it and moved start_time on.
     */
    public Claim claim(UUID scheduleId, Instant expectedStart, Instant claimedAt) {
        int updated = scheduleRepo.claim(scheduleId, expectedStart, claimedAt);
        if (updated == 1) {
            log.info("Claimed schedule {} at {}", scheduleId, claimedAt);
            return Claim.CLAIMED;
        }
        log.debug("Schedule {} already claimed by another run, skipping", scheduleId);
        return Claim.ALREADY_CLAIMED;
    }

    /**
     * Write the schedule's post-run state.
     *
     * @param next next fire time from {@link RecurrenceCalculator}, empty if none
     * @throws ScheduleCommitException if the re-arm write fails or the claim
     *                                 marker was changed underneath us
     */
    public Commit commit(Schedule schedule, Instant claimedAt, Optional<Instant> next, Instant now) {
        if (!schedule.isRecurring() || next.isEmpty()) {
            log.info("Schedule {} finished, left claimed (terminal)", schedule.getId());
            return Commit.TERMINAL;
        }

        int updated;
        try {
            updated = scheduleRepo.rearm(schedule.getId(), claimedAt, next.get(), now);
        } catch (RuntimeException e) {
            throw new ScheduleCommitException("Failed to update schedule: " + e.getMessage(), e);
        }
        if (updated != 1) {
            throw new ScheduleCommitException(
                    "Failed to update schedule: claim marker " + claimedAt + " no longer present");
        }
        log.info("Schedule {} re-armed for {}", schedule.getId(), next.get());
        return Commit.REARMED;
    }
}
