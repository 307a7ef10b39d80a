package com.autograder.services;

import com.autograder.adapters.StorageAdapter;
import com.autograder.exceptions.NotFoundException;
import com.autograder.exceptions.StorageException;
import com.autograder.exceptions.SubmissionBusyException;
import com.autograder.exceptions.UnauthorizedException;
import com.autograder.models.GradingOutcome;
import com.autograder.models.ProcessingStatus;
import com.autograder.models.RegradeReport;
import com.autograder.models.Submission;
import com.autograder.store.SubmissionStore;
import com.autograder.utils.ProcessingEvents;
import com.autograder.utils.ProcessingEvents.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Operations on existing submissions: deletion, manual reprocessing and exam-wide regrading
 */
public class SubmissionService {
    private static final Logger logger = LoggerFactory.getLogger(SubmissionService.class);

    private final SubmissionStore store;
    private final StorageAdapter storage;
    private final SubmissionProcessor processor;
    private final GradingOrchestrator gradingOrchestrator;

    public SubmissionService(SubmissionStore store, StorageAdapter storage, SubmissionProcessor processor,
                             GradingOrchestrator gradingOrchestrator) {
        this.store = store;
        this.storage = storage;
        this.processor = processor;
        this.gradingOrchestrator = gradingOrchestrator;
    }

    /**
     * Deletes the submission, its answers, its grading results and its stored bytes.
     *
     * @throws NotFoundException        when the submission does not exist
     * @throws UnauthorizedException    when {@code requesterId} did not upload it
     * @throws SubmissionBusyException  when it is being processed right now
     */
    public void deleteSubmission(String submissionId, String requesterId) {
        Submission submission = store.findSubmission(submissionId)
                .orElseThrow(() -> NotFoundException.submission(submissionId));
        if (requesterId == null || !requesterId.equals(submission.getUploadedBy())) {
            throw new UnauthorizedException("Not authorized to delete submission " + submissionId);
        }

        Submission removed = store.deleteSubmission(submissionId,
                        current -> current.getProcessingStatus() != ProcessingStatus.PROCESSING)
                .orElseThrow(() -> store.findSubmission(submissionId).isPresent()
                        ? new SubmissionBusyException(submissionId)
                        : NotFoundException.submission(submissionId));

        try {
            storage.delete(removed.getStorageKey());
        } catch (StorageException e) {
            logger.warn("Submission {} deleted but its file {} could not be removed: {}",
                    submissionId, removed.getStorageKey(), e.getMessage());
        }
        ProcessingEvents.info(submissionId, Stage.DELETE, "deleted by=" + requesterId);
    }

    /**
     * @see SubmissionProcessor#reprocess(String)
     */
    public GradingOutcome reprocess(String submissionId) {
        return processor.reprocess(submissionId);
    }

    /**
     * Grades every processed submission of the exam again. A failing submission is reported and
     * the remaining ones are still graded.
     *
     * @throws NotFoundException when the exam does not exist
     */
    public RegradeReport regradeAll(String examId) {
        if (store.findExam(examId).isEmpty()) {
            throw NotFoundException.exam(examId);
        }
        List<Submission> submissions = store.findSubmissionsByExamAndStatus(examId, ProcessingStatus.PROCESSED);
        logger.info("🔄 Regrading {} processed submissions of exam {}", submissions.size(), examId);

        List<RegradeReport.Entry> results = new ArrayList<>();
        for (Submission submission : submissions) {
            try {
                GradingOutcome outcome = gradingOrchestrator.gradeSubmission(submission.getId());
                results.add(RegradeReport.Entry.success(submission.getId(), outcome.gradedCount()));
            } catch (RuntimeException e) {
                ProcessingEvents.failure(submission.getId(), Stage.REGRADE, e.getMessage());
                results.add(RegradeReport.Entry.failure(submission.getId(), e.getMessage()));
            }
        }

        RegradeReport report = RegradeReport.of(examId, results);
        logger.info("✅ Regrade of exam {} finished: {} succeeded, {} failed",
                examId, report.succeeded(), report.failed());
        return report;
    }
}
