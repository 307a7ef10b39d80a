package com.autograder.models;

import java.util.List;

/**
 * Outcome of a batch or archive upload. Every item considered ends up in exactly one of
 * {@code succeeded} or {@code failed}.
 */
public record BatchReport(
        String examId,
        int total,
        List<UploadSuccess> succeeded,
        List<UploadFailure> failed
) {
    public BatchReport {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
    }

    public String getMessage() {
        return String.format("Uploaded %d out of %d files successfully", succeeded.size(), total);
    }

    /**
     * An item that was stored, recorded and queued for processing
     */
    public record UploadSuccess(String submissionId, String studentIdentifier, String fileName) {
    }

    /**
     * An item rejected before it produced a submission. {@code studentIdentifier} is null when it
     * could not be derived.
     */
    public record UploadFailure(String fileName, String studentIdentifier, String reason) {
    }
}
