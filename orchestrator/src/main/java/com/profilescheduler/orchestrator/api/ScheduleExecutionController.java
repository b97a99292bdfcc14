package com.profilescheduler.orchestrator.api;

import com.profilescheduler.orchestrator.api.dto.ErrorResponse;
import com.profilescheduler.orchestrator.api.dto.MessageResponse;
import com.profilescheduler.orchestrator.service.EngineConfigurationException;
import com.profilescheduler.orchestrator.service.ExecutionOrchestrator;
import com.profilescheduler.orchestrator.service.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;

/**
 * Manual trigger for the execution engine.
 *
 * GET|POST /api/schedules/execute   run everything due right now
 *
 * When profilescheduler.api.key is set the caller must send it in
 * X-API-Key. The in-process periodic trigger does not go through here.
 *
 *   200  { executed, failed, results } or { message: "No schedules to execute" }
 *   401  missing or wrong API key
 *   500  missing credential or failed due-scan; nothing was executed
 */
@RestController
@RequestMapping("/api/schedules")
public class ScheduleExecutionController {

    private static final Logger log = LoggerFactory.getLogger(ScheduleExecutionController.class);

    static final String API_KEY_HEADER = "X-API-Key";

    private final ExecutionOrchestrator orchestrator;
    private final Clock                 clock;
    private final String                apiKey;

    public ScheduleExecutionController(ExecutionOrchestrator orchestrator,
                                       Clock clock,
                                       @Value("${profilescheduler.api.key:}") String apiKey) {
        this.orchestrator = orchestrator;
        this.clock        = clock;
        this.apiKey       = apiKey;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/schedules/execute -H "X-API-Key: $KEY"
     */
    @RequestMapping(path = "/execute", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<?> execute(@RequestHeader(value = API_KEY_HEADER, required = false) String providedKey) {
        if (!authorized(providedKey)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorResponse.of("Unauthorized"));
        }
        RunReport report = orchestrator.runOnce(clock.instant());
        if (RunReport.NOTHING_DUE.equals(report.message())) {
            return ResponseEntity.ok(new MessageResponse(report.message()));
        }
        return ResponseEntity.ok(report);
    }

    /** Constant-time comparison. No key configured means the endpoint is open. */
    private boolean authorized(String providedKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return true;
        }
        if (providedKey == null) {
            return false;
        }
        return MessageDigest.isEqual(apiKey.getBytes(StandardCharsets.UTF_8),
                                     providedKey.getBytes(StandardCharsets.UTF_8));
    }

    @ExceptionHandler(EngineConfigurationException.class)
    ResponseEntity<ErrorResponse> onConfigurationError(EngineConfigurationException e) {
        log.error("Schedule run refused: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    ResponseEntity<ErrorResponse> onSelectionError(DataAccessException e) {
        log.error("Error fetching schedules", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Failed to fetch schedules", e.getMostSpecificCause().getMessage()));
    }
}
