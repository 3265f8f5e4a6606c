package com.planner.exception;

/**
 * Exception thrown when a task payload is structurally invalid,
 * e.g. the JSON cannot be parsed or is not a list of task objects.
 * Malformed field values inside a well-formed task never raise this.
 */
public class InvalidTaskInputException extends PlannerException {

    public InvalidTaskInputException(String message) {
        super(message);
    }

    public InvalidTaskInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
