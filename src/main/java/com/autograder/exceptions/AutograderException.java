package com.autograder.exceptions;

/**
 * Base type of all failures raised by the grading pipeline
 */
public class AutograderException extends RuntimeException {

    public AutograderException(String message) {
        super(message);
    }

    public AutograderException(String message, Throwable cause) {
        super(message, cause);
    }
}
