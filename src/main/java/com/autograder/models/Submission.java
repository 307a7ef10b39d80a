package com.autograder.models;

import java.time.Instant;

/**
 * One uploaded answer file tied to one exam and one student, together with the
 * extraction outcome recorded by the processing pipeline
 */
public class Submission {
    private String id;
    private String examId;
    private String studentKey;
    private String uploadedBy;
    private String fileName;
    private String storageKey;
    private long fileSize;
    private String fileType;
    private ProcessingStatus processingStatus;
    private String extractedText;
    private Double confidenceScore;
    private String errorMessage;
    private Instant createdAt;
    private Instant processedAt;

    public Submission() {}

    public Submission(String id, String examId, String studentKey, String uploadedBy,
                      String fileName, String storageKey, long fileSize, String fileType) {
        this.id = id;
        this.examId = examId;
        this.studentKey = studentKey;
        this.uploadedBy = uploadedBy;
        this.fileName = fileName;
        this.storageKey = storageKey;
        this.fileSize = fileSize;
        this.fileType = fileType;
        this.processingStatus = ProcessingStatus.UPLOADED;
        this.createdAt = Instant.now();
    }

    /**
     * Copy constructor, used by stores to hand out snapshots instead of live rows
     */
    public Submission(Submission other) {
        this.id = other.id;
        this.examId = other.examId;
        this.studentKey = other.studentKey;
        this.uploadedBy = other.uploadedBy;
        this.fileName = other.fileName;
        this.storageKey = other.storageKey;
        this.fileSize = other.fileSize;
        this.fileType = other.fileType;
        this.processingStatus = other.processingStatus;
        this.extractedText = other.extractedText;
        this.confidenceScore = other.confidenceScore;
        this.errorMessage = other.errorMessage;
        this.createdAt = other.createdAt;
        this.processedAt = other.processedAt;
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
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

    public String getUploadedBy() {
        return uploadedBy;
    }

    public void setUploadedBy(String uploadedBy) {
        this.uploadedBy = uploadedBy;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public void setStorageKey(String storageKey) {
        this.storageKey = storageKey;
    }

    public long getFileSize() {
        return fileSize;
    }

    public void setFileSize(long fileSize) {
        this.fileSize = fileSize;
    }

    public String getFileType() {
        return fileType;
    }

    public void setFileType(String fileType) {
        this.fileType = fileType;
    }

    public ProcessingStatus getProcessingStatus() {
        return processingStatus;
    }

    public void setProcessingStatus(ProcessingStatus processingStatus) {
        this.processingStatus = processingStatus;
    }

    public String getExtractedText() {
        return extractedText;
    }

    public void setExtractedText(String extractedText) {
        this.extractedText = extractedText;
    }

    public Double getConfidenceScore() {
        return confidenceScore;
    }

    public void setConfidenceScore(Double confidenceScore) {
        this.confidenceScore = confidenceScore;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public void setProcessedAt(Instant processedAt) {
        this.processedAt = processedAt;
    }

    /**
     * True when extraction left usable text behind
     */
    public boolean hasText() {
        return extractedText != null && !extractedText.isBlank();
    }

    @Override
    public String toString() {
        return "Submission{" +
                "id='" + id + '\'' +
                ", examId='" + examId + '\'' +
                ", studentKey='" + studentKey + '\'' +
                ", fileName='" + fileName + '\'' +
                ", fileSize=" + fileSize +
                ", processingStatus=" + processingStatus +
                ", createdAt=" + createdAt +
                '}';
    }
}
