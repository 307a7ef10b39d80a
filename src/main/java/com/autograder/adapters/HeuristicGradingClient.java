package com.autograder.adapters;

import com.autograder.utils.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline grader used when no OpenAI key is configured. Marks follow keyword coverage and,
 * without keywords, word overlap with the model answer.
 */
public class HeuristicGradingClient implements GradingAdapter {
    private static final Logger logger = LoggerFactory.getLogger(HeuristicGradingClient.class);

    @Override
    public GradeEvaluation grade(GradingRequest request) {
        logger.info("Heuristic evaluation for question {}", request.questionNumber());

        double ratio;
        if (!request.keywords().isEmpty()) {
            ratio = TextSimilarity.keywordCoverage(request.studentAnswer(), request.keywords());
        } else if (request.modelAnswer() != null && !request.modelAnswer().isBlank()) {
            ratio = TextSimilarity.wordOverlap(request.studentAnswer(), request.modelAnswer());
        } else {
            ratio = 0.5;
        }

        double marks = Math.round(ratio * request.maxMarks() * 2) / 2.0;
        String feedback;
        if (ratio >= 0.8) {
            feedback = "Excellent answer covering the key points.";
        } else if (ratio >= 0.5) {
            feedback = "Good answer, but some key points are missing.";
        } else if (ratio > 0.0) {
            feedback = "Partial answer with limited coverage of the key points.";
        } else {
            feedback = "The answer does not address the key points of the question.";
        }
        return new GradeEvaluation(marks, 0.4, feedback);
    }
}
