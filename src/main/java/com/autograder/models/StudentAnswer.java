package com.autograder.models;

/**
 * The answer text segmented out of a submission for one question.
 * At most one exists per (submissionId, questionId).
 */
public class StudentAnswer {
    private String id;
    private String submissionId;
    private String questionId;
    private String studentKey;
    private String extractedAnswer;
    private double confidenceScore;

    public StudentAnswer() {}

    public StudentAnswer(String id, String submissionId, String questionId, String studentKey,
                         String extractedAnswer, double confidenceScore) {
        this.id = id;
        this.submissionId = submissionId;
        this.questionId = questionId;
        this.studentKey = studentKey;
        this.extractedAnswer = extractedAnswer;
        this.confidenceScore = confidenceScore;
    }

    public StudentAnswer(StudentAnswer other) {
        this(other.id, other.submissionId, other.questionId, other.studentKey,
             other.extractedAnswer, other.confidenceScore);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSubmissionId() {
        return submissionId;
    }

    public void setSubmissionId(String submissionId) {
        this.submissionId = submissionId;
    }

    public String getQuestionId() {
        return questionId;
    }

    public void setQuestionId(String questionId) {
        this.questionId = questionId;
    }

    public String getStudentKey() {
        return studentKey;
    }

    public void setStudentKey(String studentKey) {
        this.studentKey = studentKey;
    }

    public String getExtractedAnswer() {
        return extractedAnswer;
    }

    public void setExtractedAnswer(String extractedAnswer) {
        this.extractedAnswer = extractedAnswer;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public void setConfidenceScore(double confidenceScore) {
        this.confidenceScore = confidenceScore;
    }

    @Override
    public String toString() {
        return "StudentAnswer{" +
                "id='" + id + '\'' +
                ", submissionId='" + submissionId + '\'' +
                ", questionId='" + questionId + '\'' +
                ", confidenceScore=" + confidenceScore +
                '}';
    }
}
