package com.autograder.exceptions;

public class NotFoundException extends AutograderException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException exam(String examId) {
        return new NotFoundException("Exam not found: " + examId);
    }

    public static NotFoundException submission(String submissionId) {
        return new NotFoundException("Submission not found: " + submissionId);
    }

    public static NotFoundException student(String studentIdentifier) {
        return new NotFoundException("Student with ID '" + studentIdentifier + "' not found");
    }
}
