package com.autograder.adapters;

/**
 * Outcome reported by a text extraction engine
 */
public record ExtractionResult(Status status, String text, double confidence) {

    public enum Status {
        SUCCESS,
        FAILURE
    }

    public static ExtractionResult success(String text, double confidence) {
        return new ExtractionResult(Status.SUCCESS, text, confidence);
    }

    public static ExtractionResult failure(String reason) {
        return new ExtractionResult(Status.FAILURE, reason, 0.0);
    }

    /**
     * Usable only when the engine succeeded and produced more than whitespace
     */
    public boolean hasUsableText() {
        return status == Status.SUCCESS && text != null && !text.isBlank();
    }
}
