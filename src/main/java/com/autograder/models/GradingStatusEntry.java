package com.autograder.models;

/**
 * Grading progress of one submission of an exam
 */
public record GradingStatusEntry(
        String submissionId,
        String studentKey,
        String studentName,
        ProcessingStatus processingStatus,
        boolean hasText,
        int studentAnswersCount,
        int gradingResultsCount,
        boolean graded,
        boolean fullyGraded
) {
}
