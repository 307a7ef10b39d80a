package com.autograder.models;

import java.util.List;

/**
 * Per-submission report of a regrade over a whole exam
 */
public record RegradeReport(String examId, int total, int succeeded, int failed, List<Entry> results) {

    public RegradeReport {
        results = List.copyOf(results);
    }

    public static RegradeReport of(String examId, List<Entry> results) {
        int succeeded = (int) results.stream().filter(Entry::success).count();
        return new RegradeReport(examId, results.size(), succeeded, results.size() - succeeded, results);
    }

    public record Entry(String submissionId, boolean success, int gradedCount, String error) {

        public static Entry success(String submissionId, int gradedCount) {
            return new Entry(submissionId, true, gradedCount, null);
        }

        public static Entry failure(String submissionId, String error) {
            return new Entry(submissionId, false, 0, error);
        }
    }
}
