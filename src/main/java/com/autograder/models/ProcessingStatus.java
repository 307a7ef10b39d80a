package com.autograder.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a submission inside the processing pipeline.
 *
 * <pre>
 * uploaded   --dispatch--------------------------&gt; processing
 * processing --text extracted--------------------&gt; processed
 * processing --extraction failure / empty / error-&gt; failed
 * processed | failed --reprocess------------------&gt; processing
 * </pre>
 */
public enum ProcessingStatus {
    UPLOADED("uploaded"),
    PROCESSING("processing"),
    PROCESSED("processed"),
    FAILED("failed");

    private final String value;

    ProcessingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ProcessingStatus fromValue(String value) {
        for (ProcessingStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown processing status: " + value);
    }

    /**
     * Automatic transitions driven by the task dispatcher.
     */
    public boolean canTransitionTo(ProcessingStatus next) {
        switch (this) {
            case UPLOADED:
                return next == PROCESSING;
            case PROCESSING:
                return next == PROCESSED || next == FAILED;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
