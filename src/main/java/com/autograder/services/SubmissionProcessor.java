package com.autograder.services;

import com.autograder.adapters.ExtractionResult;
import com.autograder.adapters.StorageAdapter;
import com.autograder.adapters.TextExtractionAdapter;
import com.autograder.exceptions.ExtractionFailureException;
import com.autograder.exceptions.NotFoundException;
import com.autograder.exceptions.SubmissionBusyException;
import com.autograder.models.GradingOutcome;
import com.autograder.models.ProcessingStatus;
import com.autograder.models.Submission;
import com.autograder.store.SubmissionStore;
import com.autograder.utils.AdapterCalls;
import com.autograder.utils.AnswerSegmenter;
import com.autograder.utils.ProcessingEvents;
import com.autograder.utils.ProcessingEvents.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Moves one submission through extraction and segmentation and hands processed submissions to
 * grading. Used by the background workers and by manual reprocessing.
 *
 * <p>Once a submission has been claimed ({@code processing}) it always leaves this class as
 * {@code processed} or {@code failed}, unless it was deleted in the meantime.
 */
public class SubmissionProcessor {
    private static final Logger logger = LoggerFactory.getLogger(SubmissionProcessor.class);

    private final SubmissionStore store;
    private final StorageAdapter storage;
    private final TextExtractionAdapter extractor;
    private final GradingOrchestrator gradingOrchestrator;
    private final Duration adapterTimeout;
    private final ExecutorService adapterExecutor;

    public SubmissionProcessor(SubmissionStore store, StorageAdapter storage, TextExtractionAdapter extractor,
                               GradingOrchestrator gradingOrchestrator, Duration adapterTimeout,
                               ExecutorService adapterExecutor) {
        this.store = store;
        this.storage = storage;
        this.extractor = extractor;
        this.gradingOrchestrator = gradingOrchestrator;
        this.adapterTimeout = adapterTimeout;
        this.adapterExecutor = adapterExecutor;
    }

    /**
     * Processes a submission taken off the queue. Submissions that are no longer {@code uploaded}
     * (already claimed by a reprocess, or deleted) are skipped.
     *
     * @return the status the submission ended in, or empty when it was skipped or deleted
     */
    public Optional<ProcessingStatus> processQueued(String submissionId) {
        AtomicReference<ProcessingStatus> previous = new AtomicReference<>();
        Optional<Submission> claimed = store.updateSubmission(submissionId, current -> {
            previous.set(current.getProcessingStatus());
            if (current.getProcessingStatus().canTransitionTo(ProcessingStatus.PROCESSING)) {
                current.setProcessingStatus(ProcessingStatus.PROCESSING);
            }
            return current;
        });

        if (claimed.isEmpty()) {
            ProcessingEvents.info(submissionId, Stage.DISPATCH, "skipped reason=deleted");
            return Optional.empty();
        }
        if (previous.get() != ProcessingStatus.UPLOADED) {
            ProcessingEvents.info(submissionId, Stage.DISPATCH, "skipped status=" + previous.get());
            return Optional.empty();
        }
        ProcessingEvents.transition(submissionId, ProcessingStatus.UPLOADED, ProcessingStatus.PROCESSING, Stage.DISPATCH);

        ProcessingStatus outcome = extractAndSegment(claimed.get(), Stage.EXTRACTION);
        if (outcome == ProcessingStatus.PROCESSED) {
            try {
                gradingOrchestrator.gradeSubmission(submissionId);
            } catch (RuntimeException e) {
                ProcessingEvents.failure(submissionId, Stage.GRADING, e.getMessage());
            }
        }
        return Optional.ofNullable(outcome);
    }

    /**
     * Re-runs extraction, segmentation and grading for one submission, whatever terminal or
     * pending status it has. Answers and results of the previous run are discarded first.
     *
     * @throws NotFoundException        when the submission does not exist
     * @throws SubmissionBusyException  when a worker is processing it right now
     */
    public GradingOutcome reprocess(String submissionId) {
        AtomicReference<ProcessingStatus> previous = new AtomicReference<>();
        Submission claimed = store.updateSubmission(submissionId, current -> {
            previous.set(current.getProcessingStatus());
            if (current.getProcessingStatus() != ProcessingStatus.PROCESSING) {
                current.setProcessingStatus(ProcessingStatus.PROCESSING);
                current.setErrorMessage(null);
            }
            return current;
        }).orElseThrow(() -> NotFoundException.submission(submissionId));

        if (previous.get() == ProcessingStatus.PROCESSING) {
            throw new SubmissionBusyException(submissionId);
        }
        ProcessingEvents.transition(submissionId, previous.get(), ProcessingStatus.PROCESSING, Stage.REPROCESS);
        int dropped = store.deleteGradedAnswers(submissionId);
        ProcessingEvents.info(submissionId, Stage.REPROCESS, "cleared previous answers=" + dropped);

        ProcessingStatus outcome = extractAndSegment(claimed, Stage.REPROCESS);
        if (outcome != ProcessingStatus.PROCESSED) {
            return GradingOutcome.nothingGraded(submissionId);
        }
        return gradingOrchestrator.gradeSubmission(submissionId);
    }

    /**
     * @return the terminal status written, or null when the submission disappeared
     */
    private ProcessingStatus extractAndSegment(Submission submission, Stage stage) {
        String submissionId = submission.getId();
        boolean finalized = false;
        try {
            byte[] content = storage.read(submission.getStorageKey());
            ExtractionResult extraction = AdapterCalls.callWithTimeout("text extraction",
                    () -> extractor.extract(content, submission.getFileType()), adapterTimeout, adapterExecutor);
            String text = usableText(extraction);

            SortedMap<Integer, String> segments = AnswerSegmenter.segment(text);
            ProcessingEvents.info(submissionId, Stage.SEGMENTATION, "segmented answers=" + segments.keySet());

            Optional<Submission> processed = store.updateSubmission(submissionId, current -> {
                current.setExtractedText(text);
                current.setConfidenceScore(extraction.confidence());
                current.setProcessingStatus(ProcessingStatus.PROCESSED);
                current.setErrorMessage(null);
                current.setProcessedAt(Instant.now());
                return current;
            });
            finalized = true;
            if (processed.isEmpty()) {
                ProcessingEvents.info(submissionId, stage, "stopped reason=submission-deleted");
                return null;
            }
            ProcessingEvents.transition(submissionId, ProcessingStatus.PROCESSING, ProcessingStatus.PROCESSED, stage);
            return ProcessingStatus.PROCESSED;
        } catch (ExtractionFailureException e) {
            finalized = true;
            return markFailed(submissionId, e.getMessage(), stage);
        } catch (RuntimeException e) {
            logger.error("Processing of submission {} failed", submissionId, e);
            finalized = true;
            return markFailed(submissionId, "Processing failed: " + e.getMessage(), stage);
        } finally {
            if (!finalized) {
                markFailed(submissionId, "Processing aborted", stage);
            }
        }
    }

    /**
     * @throws ExtractionFailureException when the engine failed or produced only whitespace
     */
    private static String usableText(ExtractionResult extraction) {
        if (extraction.status() == ExtractionResult.Status.FAILURE) {
            throw new ExtractionFailureException("Text extraction failed: " + extraction.text());
        }
        if (!extraction.hasUsableText()) {
            throw new ExtractionFailureException("Text extraction produced no text");
        }
        return extraction.text();
    }

    private ProcessingStatus markFailed(String submissionId, String reason, Stage stage) {
        Optional<Submission> failed = store.updateSubmission(submissionId, current -> {
            current.setProcessingStatus(ProcessingStatus.FAILED);
            current.setErrorMessage(reason);
            current.setExtractedText(null);
            current.setConfidenceScore(null);
            current.setProcessedAt(Instant.now());
            return current;
        });
        if (failed.isEmpty()) {
            ProcessingEvents.info(submissionId, stage, "stopped reason=submission-deleted");
            return null;
        }
        ProcessingEvents.failure(submissionId, stage, reason);
        ProcessingEvents.transition(submissionId, ProcessingStatus.PROCESSING, ProcessingStatus.FAILED, stage);
        return ProcessingStatus.FAILED;
    }
}
