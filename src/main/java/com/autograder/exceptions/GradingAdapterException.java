package com.autograder.exceptions;

/**
 * A grading call failed, timed out or returned something unusable.
 * Always scoped to a single question.
 */
public class GradingAdapterException extends AutograderException {

    public GradingAdapterException(String message) {
        super(message);
    }

    public GradingAdapterException(String message, Throwable cause) {
        super(message, cause);
    }
}
