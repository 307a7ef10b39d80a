package com.autograder.adapters;

import java.util.Set;

/**
 * Everything the grading model gets to see for one question
 */
public record GradingRequest(
        int questionNumber,
        String questionText,
        String modelAnswer,
        String markingScheme,
        double maxMarks,
        Set<String> keywords,
        String studentAnswer
) {
    public GradingRequest {
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
    }
}
