package com.autograder.models;

import java.util.Set;

/**
 * A question of an exam, graded independently of the others
 */
public record Question(
        String id,
        String examId,
        int questionNumber,
        String text,
        double maxMarks,
        String markingScheme,
        String sampleAnswer,
        Set<String> keywords
) {
    public Question {
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
    }
}
