package com.profilescheduler.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Per-schedule result of one run. Lives only in the run's response.
 *
 * success reflects device resolution and the state commit; individual
 * device failures are reported in deviceResults / devicesFailed but do not
 * flip it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionOutcome(
        UUID                jobId,
        String              profileId,
        Integer             devicesCount,
        Integer             devicesSucceeded,
        Integer             devicesFailed,
        boolean             success,
        String              message,
        String              error,
        Instant             nextFireTime,
        List<DeviceOutcome> deviceResults
) {
    public static ExecutionOutcome succeeded(UUID jobId, String profileId,
                                             List<DeviceOutcome> deviceResults, Instant nextFireTime) {
        int ok = (int) deviceResults.stream().filter(DeviceOutcome::success).count();
        return new ExecutionOutcome(
                jobId,
                profileId,
                deviceResults.size(),
                ok,
                deviceResults.size() - ok,
                true,
                "Profile " + profileId + " pushed to " + deviceResults.size() + " devices",
                null,
                nextFireTime,
                deviceResults);
    }

    public static ExecutionOutcome failed(UUID jobId, String profileId, String error) {
        return new ExecutionOutcome(jobId, profileId, null, null, null,
                false, null, error, null, null);
    }
}
