package com.profilescheduler.orchestrator.service;

/**
 * A run cannot start because a required setting (credential, store) is
 * missing. Nothing is selected or claimed when this is thrown.
 */
public class EngineConfigurationException extends RuntimeException {

    public EngineConfigurationException(String message) {
        super(message);
    }
}
