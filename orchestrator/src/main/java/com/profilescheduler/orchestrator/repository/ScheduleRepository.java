package com.profilescheduler.orchestrator.repository;

import com.profilescheduler.orchestrator.model.Schedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Due-scan, claim and re-arm queries for the schedules table.
 *
 * The two UPDATE queries are the only writes the engine performs. Both are
 * conditional, so a stale read can never overwrite another run's claim.
 */
public interface ScheduleRepository extends JpaRepository<Schedule, UUID> {

    /**
     * Enabled, unclaimed schedules whose start_time lies in (from, to],
     * earliest first.
     */
    @Query("""
            SELECT s FROM Schedule s
            WHERE s.enabled = true
              AND s.lastExecutedAt IS NULL
              AND s.startTime > :from
              AND s.startTime <= :to
            ORDER BY s.startTime ASC
            """)
    List<Schedule> findDue(@Param("from") Instant from, @Param("to") Instant to);

    /**
     * Compare-and-set claim: last_executed_at NULL → claimedAt, on the row
     * exactly as the caller scanned it. Matching start_time keeps a run with a
     * stale scan from claiming an occurrence another run already re-armed.
     *
     * @return 1 if this caller won the claim, 0 if the row was already
     *         claimed, re-armed, disabled or deleted in the meantime
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE Schedule s
            SET s.lastExecutedAt = :claimedAt, s.updatedAt = :claimedAt
            WHERE s.id = :id
              AND s.enabled = true
              AND s.lastExecutedAt IS NULL
              AND s.startTime = :expectedStart
            """)
    int claim(@Param("id") UUID id,
              @Param("expectedStart") Instant expectedStart,
              @Param("claimedAt") Instant claimedAt);

    /**
     * Re-arm a recurring schedule after its run: move start_time forward and
     * clear the claim marker. Only applies while the row still carries the
     * marker this run wrote.
     *
     * @return 1 on success, 0 if the claim marker no longer matches
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE Schedule s
            SET s.startTime = :nextStart, s.lastExecutedAt = NULL, s.updatedAt = :now
            WHERE s.id = :id
              AND s.lastExecutedAt = :claimedAt
            """)
    int rearm(@Param("id") UUID id,
              @Param("claimedAt") Instant claimedAt,
              @Param("nextStart") Instant nextStart,
              @Param("now") Instant now);
}
