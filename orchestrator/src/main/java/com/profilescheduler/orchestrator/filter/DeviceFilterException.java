package com.profilescheduler.orchestrator.filter;

/**
 * Thrown when a device_filter blob cannot be interpreted.
 */
public class DeviceFilterException extends RuntimeException {

    public DeviceFilterException(String message) {
        super(message);
    }

    public DeviceFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
