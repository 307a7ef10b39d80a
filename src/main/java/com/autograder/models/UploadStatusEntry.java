package com.autograder.models;

/**
 * A submission together with the roster details of its student, for upload progress views.
 * Student fields are null when the roster no longer knows the student.
 */
public record UploadStatusEntry(Submission submission, String studentIdentifier, String studentName) {
}
