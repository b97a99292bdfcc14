package com.profilescheduler.orchestrator.mdm.dto;

/**
 * A device as resolved for one run. Never persisted by the engine.
 */
public record Device(String id, String name) {}
