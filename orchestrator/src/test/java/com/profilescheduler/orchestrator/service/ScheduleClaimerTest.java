package com.profilescheduler.orchestrator.service;

import com.profilescheduler.orchestrator.model.RecurrencePattern;
import com.profilescheduler.orchestrator.model.Schedule;
import com.profilescheduler.orchestrator.repository.ScheduleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduleClaimerTest {

    @Mock ScheduleRepository scheduleRepo;

    ScheduleClaimer claimer;

    final Instant start     = Instant.parse("2024-01-01T09:00:00Z");
    final Instant claimedAt = Instant.parse("2024-01-01T09:05:00.123Z");
    final Instant now       = Instant.parse("2024-01-01T09:05:02Z");

    @BeforeEach
    void setUp() {
        claimer = new ScheduleClaimer(scheduleRepo);
    }

    // ------------------------------------------------------------------
    // claim()
    // ------------------------------------------------------------------

    @Test
    void claim_rowUpdated_claimed() {
        Schedule s = Schedules.oneShot(start, "p1");
        when(scheduleRepo.claim(s.getId(), start, claimedAt)).thenReturn(1);

        assertThat(claimer.claim(s.getId(), start, claimedAt)).isEqualTo(ScheduleClaimer.Claim.CLAIMED);
    }

    @Test
    void claim_noRowUpdated_alreadyClaimed() {
        Schedule s = Schedules.oneShot(start, "p1");
        when(scheduleRepo.claim(s.getId(), start, claimedAt)).thenReturn(0);

        assertThat(claimer.claim(s.getId(), start, claimedAt)).isEqualTo(ScheduleClaimer.Claim.ALREADY_CLAIMED);
    }

    @Test
    void markerFor_truncatesToMillis() {
        assertThat(ScheduleClaimer.markerFor(Instant.parse("2024-01-01T09:05:00.123456789Z")))
                .isEqualTo(Instant.parse("2024-01-01T09:05:00.123Z"));
    }

    // ------------------------------------------------------------------
    // commit()
    // ------------------------------------------------------------------

    @Test
    void commit_oneShot_staysClaimedWithoutWrite() {
        Schedule s = Schedules.oneShot(start, "p1");

        assertThat(claimer.commit(s, claimedAt, Optional.empty(), now)).isEqualTo(ScheduleClaimer.Commit.TERMINAL);
        verifyNoInteractions(scheduleRepo);
    }

    @Test
    void commit_recurringWithNext_rearms() {
        Schedule s = Schedules.recurring(start, "p1", RecurrencePattern.DAILY, Set.of());
        Instant next = start.plusSeconds(86_400);
        when(scheduleRepo.rearm(s.getId(), claimedAt, next, now)).thenReturn(1);

        assertThat(claimer.commit(s, claimedAt, Optional.of(next), now)).isEqualTo(ScheduleClaimer.Commit.REARMED);
    }

    @Test
    void commit_recurringWithoutNext_terminal() {
        Schedule s = Schedules.recurring(start, "p1", RecurrencePattern.UNRECOGNIZED, Set.of());

        assertThat(claimer.commit(s, claimedAt, Optional.empty(), now)).isEqualTo(ScheduleClaimer.Commit.TERMINAL);
        verify(scheduleRepo, never()).rearm(any(), any(), any(), any());
    }

    @Test
    void commit_markerGone_throwsCommitException() {
        Schedule s = Schedules.recurring(start, "p1", RecurrencePattern.DAILY, Set.of());
        when(scheduleRepo.rearm(any(), any(), any(), any())).thenReturn(0);

        assertThatThrownBy(() -> claimer.commit(s, claimedAt, Optional.of(start.plusSeconds(86_400)), now))
                .isInstanceOf(ScheduleCommitException.class)
                .hasMessageContaining("Failed to update schedule");
    }

    @Test
    void commit_storeFailure_throwsCommitException() {
        Schedule s = Schedules.recurring(start, "p1", RecurrencePattern.DAILY, Set.of());
        when(scheduleRepo.rearm(any(), any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThatThrownBy(() -> claimer.commit(s, claimedAt, Optional.of(start.plusSeconds(86_400)), now))
                .isInstanceOf(ScheduleCommitException.class)
                .hasMessageContaining("connection reset");
    }
}
