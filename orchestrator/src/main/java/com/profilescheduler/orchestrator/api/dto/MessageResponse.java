package com.profilescheduler.orchestrator.api.dto;

/** Body of a run that found nothing due: { message }. */
public record MessageResponse(String message) {
}
