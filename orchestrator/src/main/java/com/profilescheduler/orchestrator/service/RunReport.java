package com.profilescheduler.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result of one run. Counts are always present; an empty due-scan gives
 * zero counts, no results and the {@link #NOTHING_DUE} message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunReport(
        int                    executed,
        int                    failed,
        List<ExecutionOutcome> results,
        String                 message
) {
    public static final String NOTHING_DUE = "No schedules to execute";

    public static RunReport nothingDue() {
        return new RunReport(0, 0, List.of(), NOTHING_DUE);
    }

    public static RunReport of(List<ExecutionOutcome> results) {
        int ok = (int) results.stream().filter(ExecutionOutcome::success).count();
        return new RunReport(ok, results.size() - ok, List.copyOf(results), null);
    }
}
