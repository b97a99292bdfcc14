package com.profilescheduler.orchestrator.service;

import com.profilescheduler.orchestrator.mdm.DeviceManagementClient;
import com.profilescheduler.orchestrator.mdm.dto.Device;
import com.profilescheduler.orchestrator.model.Schedule;
import com.profilescheduler.orchestrator.repository.ScheduleRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs every schedule that is due right now.
 *
 * One run:
 *  1. Due window = (now - W, now]
 *  2. Select enabled, unclaimed schedules in the window, earliest first
 *  3. Per schedule, on the job pool:
 *       claim → resolve devices → push to all → compute next → commit
 *     A lost claim is skipped silently; any other failure becomes that
 *     schedule's {@code success=false} outcome.
 *  4. Aggregate into a {@link RunReport}
 *
 * Safe to call concurrently: double execution is prevented by the claim,
 * not by anything in this class.
 *
 * Only a missing credential or a failing due-scan escapes runOnce(); both
 * happen before anything is claimed.
 */
@Service
public class ExecutionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionOrchestrator.class);

    private final ScheduleRepository     scheduleRepo;
    private final ScheduleClaimer        claimer;
    private final DeviceResolver         resolver;
    private final ProfilePusher          pusher;
    private final RecurrenceCalculator   recurrence;
    private final DeviceManagementClient mdm;
    private final MeterRegistry          meterRegistry;
    private final Clock                  clock;
    private final Duration               dueWindow;
    private final Duration               shutdownGrace;
    private final ExecutorService        jobWorkers;

    public ExecutionOrchestrator(ScheduleRepository scheduleRepo,
                                 ScheduleClaimer claimer,
                                 DeviceResolver resolver,
                                 ProfilePusher pusher,
                                 RecurrenceCalculator recurrence,
                                 DeviceManagementClient mdm,
                                 MeterRegistry meterRegistry,
                                 Clock clock,
                                 @Value("${profilescheduler.execution.due-window:PT15M}") Duration dueWindow,
                                 @Value("${profilescheduler.execution.job-workers:4}") int jobWorkerCount,
                                 @Value("${profilescheduler.execution.shutdown-grace:PT60S}") Duration shutdownGrace) {
        this.scheduleRepo  = scheduleRepo;
        this.claimer       = claimer;
        this.resolver      = resolver;
        this.pusher        = pusher;
        this.recurrence    = recurrence;
        this.mdm           = mdm;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.dueWindow     = dueWindow;
        this.shutdownGrace = shutdownGrace;
        this.jobWorkers    = Executors.newFixedThreadPool(jobWorkerCount,
                new CustomizableThreadFactory("schedule-run-"));
    }

    /**
     * Execute all schedules due at now.
     *
     * @throws EngineConfigurationException if the device-management credential is missing
     * @throws org.springframework.dao.DataAccessException if the due-scan fails
     */
    public RunReport runOnce(Instant now) {
        if (!mdm.isConfigured()) {
            throw new EngineConfigurationException("SimpleMDM API key not configured");
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<Schedule> due = scheduleRepo.findDue(now.minus(dueWindow), now);
            if (due.isEmpty()) {
                log.debug("No schedules due at {}", now);
                return RunReport.nothingDue();
            }
            log.info("Found {} schedules to execute", due.size());

            Instant claimedAt = ScheduleClaimer.markerFor(now);
            List<CompletableFuture<Optional<ExecutionOutcome>>> pending = new ArrayList<>();
            for (Schedule schedule : due) {
                try {
                    pending.add(CompletableFuture.supplyAsync(
                            () -> claimAndExecute(schedule, claimedAt), jobWorkers));
                } catch (RejectedExecutionException e) {
                    // Shutting down. Not claimed yet, so the next run picks it up.
                    log.warn("Engine shutting down, schedule {} left for the next run", schedule.getId());
                }
            }

            List<ExecutionOutcome> results = pending.stream()
                    .map(CompletableFuture::join)
                    .flatMap(Optional::stream)
                    .toList();

            RunReport report = RunReport.of(results);
            log.info("Run finished: {} executed, {} failed", report.executed(), report.failed());
            return report;
        } finally {
            sample.stop(meterRegistry.timer("profilescheduler.run.duration"));
        }
    }

    /** Convenience overload using the injected clock. */
    public RunReport runOnce() {
        return runOnce(clock.instant());
    }

    // ------------------------------------------------------------------
    // Per-schedule pipeline
    // ------------------------------------------------------------------

    /** Empty when another run holds the claim. Never throws. */
    private Optional<ExecutionOutcome> claimAndExecute(Schedule schedule, Instant claimedAt) {
        try {
            if (claimer.claim(schedule.getId(), schedule.getStartTime(), claimedAt) == ScheduleClaimer.Claim.ALREADY_CLAIMED) {
                return Optional.empty();
            }
            ExecutionOutcome outcome = execute(schedule, claimedAt);
            meterRegistry.counter("profilescheduler.schedule.runs", "outcome", "success").increment();
            return Optional.of(outcome);
        } catch (Exception e) {
            log.error("Error executing schedule {}: {}", schedule.getId(), e.getMessage(), e);
            meterRegistry.counter("profilescheduler.schedule.runs", "outcome", "failure").increment();
            return Optional.of(ExecutionOutcome.failed(schedule.getId(), schedule.getProfileId(), e.getMessage()));
        }
    }

    private ExecutionOutcome execute(Schedule schedule, Instant claimedAt) {
        // Resolution must finish before any push; all pushes before the commit.
        List<Device> targets = resolver.resolve(schedule.getId(), schedule.getDeviceFilter());
        List<DeviceOutcome> pushes = pusher.pushAll(schedule.getProfileId(), targets);

        Optional<Instant> next = recurrence.next(schedule);
        claimer.commit(schedule, claimedAt, next, clock.instant());

        long failedPushes = pushes.stream().filter(p -> !p.success()).count();
        if (failedPushes > 0) {
            log.warn("Schedule {}: {}/{} device pushes failed", schedule.getId(), failedPushes, pushes.size());
        }
        return ExecutionOutcome.succeeded(schedule.getId(), schedule.getProfileId(), pushes, next.orElse(null));
    }

    /**
     * Stop accepting runs and give in-flight schedules time to push and
     * commit, so already-claimed schedules are not left claimed by a deploy.
     */
    @PreDestroy
    void shutdown() throws InterruptedException {
        jobWorkers.shutdown();
        if (!jobWorkers.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Schedules still running after {}, forcing shutdown", shutdownGrace);
            jobWorkers.shutdownNow();
        }
    }
}
