package com.autograder.adapters;

/**
 * Marks, confidence and feedback returned by the grading model for one answer
 */
public record GradeEvaluation(double marks, double confidence, String feedback) {

    /**
     * Marks clamped into {@code [0, maxMarks]}; models occasionally overshoot.
     */
    public double boundedMarks(double maxMarks) {
        if (Double.isNaN(marks) || marks < 0) {
            return 0.0;
        }
        return Math.min(marks, maxMarks);
    }

    @Override
    public String toString() {
        return String.format("%.2f marks (confidence %.2f)", marks, confidence);
    }
}
