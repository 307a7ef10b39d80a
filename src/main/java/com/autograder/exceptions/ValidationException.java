package com.autograder.exceptions;

/**
 * Bad input: count mismatch, missing filename, disallowed extension, oversized file
 */
public class ValidationException extends AutograderException {

    public ValidationException(String message) {
        super(message);
    }
}
