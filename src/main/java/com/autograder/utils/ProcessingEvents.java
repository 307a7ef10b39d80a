package com.autograder.utils;

import com.autograder.models.ProcessingStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Structured pipeline events. Every event carries {@code submissionId} and {@code stage} both in the
 * MDC and in the message, so they can be filtered per submission regardless of the log layout.
 */
public final class ProcessingEvents {
    private static final Logger logger = LoggerFactory.getLogger("com.autograder.events");

    public static final String SUBMISSION_KEY = "submissionId";
    public static final String STAGE_KEY = "stage";

    public enum Stage {
        INTAKE,
        DISPATCH,
        EXTRACTION,
        SEGMENTATION,
        GRADING,
        REPROCESS,
        REGRADE,
        DELETE;

        String label() {
            return name().toLowerCase();
        }
    }

    private ProcessingEvents() {}

    public static void transition(String submissionId, ProcessingStatus from, ProcessingStatus to, Stage stage) {
        withContext(submissionId, stage, () -> {
            logger.info("event=transition stage={} submission={} from={} to={}",
                    stage.label(), submissionId, from, to);
            return null;
        });
    }

    public static void info(String submissionId, Stage stage, String detail) {
        withContext(submissionId, stage, () -> {
            logger.info("event={} stage={} submission={}", detail, stage.label(), submissionId);
            return null;
        });
    }

    public static void failure(String submissionId, Stage stage, String reason) {
        withContext(submissionId, stage, () -> {
            logger.warn("event=failure stage={} submission={} reason=\"{}\"", stage.label(), submissionId, reason);
            return null;
        });
    }

    /**
     * Runs {@code body} with the submission and stage in the MDC, restoring the previous context afterwards
     */
    public static <T> T withContext(String submissionId, Stage stage, Supplier<T> body) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        try {
            if (submissionId != null) {
                MDC.put(SUBMISSION_KEY, submissionId);
            }
            MDC.put(STAGE_KEY, stage.label());
            return body.get();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }
}
