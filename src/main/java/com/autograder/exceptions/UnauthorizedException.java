package com.autograder.exceptions;

/**
 * Raised when a requester acts on a submission uploaded by someone else
 */
public class UnauthorizedException extends AutograderException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
