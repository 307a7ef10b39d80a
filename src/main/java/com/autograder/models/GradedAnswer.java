package com.autograder.models;

/**
 * The answer/result pair stored for one (submission, question)
 */
public record GradedAnswer(StudentAnswer answer, GradingResult result) {
}
