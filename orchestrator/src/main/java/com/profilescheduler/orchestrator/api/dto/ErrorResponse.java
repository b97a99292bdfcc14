package com.profilescheduler.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body of the trigger endpoint: { error, details? }.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String details) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
