package com.autograder.exceptions;

/**
 * Text extraction reported failure or produced no usable text
 */
public class ExtractionFailureException extends AutograderException {

    public ExtractionFailureException(String message) {
        super(message);
    }
}
