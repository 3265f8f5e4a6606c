package com.planner.exception;

/**
 * Exception thrown when planner configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends PlannerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
