package com.autograder.models;

/**
 * Result of grading one submission
 */
public record GradingOutcome(String submissionId, int questionsConsidered, int gradedCount) {

    public static GradingOutcome nothingGraded(String submissionId) {
        return new GradingOutcome(submissionId, 0, 0);
    }

    public int ungradedCount() {
        return questionsConsidered - gradedCount;
    }
}
