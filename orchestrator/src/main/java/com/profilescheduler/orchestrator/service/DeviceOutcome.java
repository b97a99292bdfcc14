package com.profilescheduler.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one profile push to one device. error is null on success.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceOutcome(String deviceId, boolean success, String error) {

    public static DeviceOutcome ok(String deviceId) {
        return new DeviceOutcome(deviceId, true, null);
    }

    public static DeviceOutcome failed(String deviceId, String reason) {
        return new DeviceOutcome(deviceId, false, reason);
    }
}
