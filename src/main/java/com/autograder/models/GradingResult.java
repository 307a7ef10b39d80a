package com.autograder.models;

import java.time.Instant;

/**
 * Marks and feedback for one graded student answer
 */
public class GradingResult {
    private String id;
    private String studentAnswerId;
    private String examId;
    private String studentKey;
    private String questionId;
    private double aiMarks;
    private double finalMarks;
    private String feedback;
    private double aiConfidence;
    private double similarityScore;
    private boolean reviewedByTeacher;
    private Instant gradedAt;

    public GradingResult() {
        this.gradedAt = Instant.now();
    }

    public GradingResult(String id, String studentAnswerId, String examId, String studentKey, String questionId) {
        this();
        this.id = id;
        this.studentAnswerId = studentAnswerId;
        this.examId = examId;
        this.studentKey = studentKey;
        this.questionId = questionId;
    }

    public GradingResult(GradingResult other) {
        this(other.id, other.studentAnswerId, other.examId, other.studentKey, other.questionId);
        this.aiMarks = other.aiMarks;
        this.finalMarks = other.finalMarks;
        this.feedback = other.feedback;
        this.aiConfidence = other.aiConfidence;
        this.similarityScore = other.similarityScore;
        this.reviewedByTeacher = other.reviewedByTeacher;
        this.gradedAt = other.gradedAt;
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getStudentAnswerId() {
        return studentAnswerId;
    }

    public void setStudentAnswerId(String studentAnswerId) {
        this.studentAnswerId = studentAnswerId;
    }

    public String getExamId() {
        return examId;
    }

    public void setExamId(String examId) {
        this.examId = examId;
    }

    public String getStudentKey() {
        return studentKey;
    }

    public void setStudentKey(String studentKey) {
        this.studentKey = studentKey;
    }

    public String getQuestionId() {
        return questionId;
    }

    public void setQuestionId(String questionId) {
        this.questionId = questionId;
    }

    public double getAiMarks() {
        return aiMarks;
    }

    public void setAiMarks(double aiMarks) {
        this.aiMarks = aiMarks;
    }

    public double getFinalMarks() {
        return finalMarks;
    }

    public void setFinalMarks(double finalMarks) {
        this.finalMarks = finalMarks;
    }

    public String getFeedback() {
        return feedback;
    }

    public void setFeedback(String feedback) {
        this.feedback = feedback;
    }

    public double getAiConfidence() {
        return aiConfidence;
    }

    public void setAiConfidence(double aiConfidence) {
        this.aiConfidence = aiConfidence;
    }

    public double getSimilarityScore() {
        return similarityScore;
    }

    public void setSimilarityScore(double similarityScore) {
        this.similarityScore = similarityScore;
    }

    public boolean isReviewedByTeacher() {
        return reviewedByTeacher;
    }

    public void setReviewedByTeacher(boolean reviewedByTeacher) {
        this.reviewedByTeacher = reviewedByTeacher;
    }

    public Instant getGradedAt() {
        return gradedAt;
    }

    public void setGradedAt(Instant gradedAt) {
        this.gradedAt = gradedAt;
    }

    @Override
    public String toString() {
        return "GradingResult{" +
                "id='" + id + '\'' +
                ", questionId='" + questionId + '\'' +
                ", studentKey='" + studentKey + '\'' +
                ", aiMarks=" + aiMarks +
                ", finalMarks=" + finalMarks +
                ", reviewedByTeacher=" + reviewedByTeacher +
                ", gradedAt=" + gradedAt +
                '}';
    }
}
