package com.autograder.exceptions;

/**
 * Raised when an operation would race with a worker that currently owns the submission
 */
public class SubmissionBusyException extends AutograderException {

    public SubmissionBusyException(String submissionId) {
        super("Submission " + submissionId + " is currently being processed");
    }
}
