package com.profilescheduler.orchestrator.mdm;

/**
 * Thrown when the device-management API returns a non-2xx status or cannot
 * be reached. statusCode is -1 for transport failures.
 */
public class MdmApiException extends RuntimeException {

    private final int statusCode;

    public MdmApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public MdmApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int statusCode() { return statusCode; }
}
