package com.autograder.services;

/**
 * Hand-off point between intake and background processing
 */
public interface SubmissionQueue {

    /**
     * Queues the submission for processing and returns immediately
     */
    void enqueue(String submissionId);
}
