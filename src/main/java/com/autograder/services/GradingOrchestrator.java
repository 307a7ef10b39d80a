package com.autograder.services;

import com.autograder.adapters.GradeEvaluation;
import com.autograder.adapters.GradingAdapter;
import com.autograder.adapters.GradingRequest;
import com.autograder.exceptions.NotFoundException;
import com.autograder.models.Exam;
import com.autograder.models.GradingOutcome;
import com.autograder.models.GradingResult;
import com.autograder.models.ProcessingStatus;
import com.autograder.models.Question;
import com.autograder.models.StudentAnswer;
import com.autograder.models.Submission;
import com.autograder.store.SubmissionStore;
import com.autograder.utils.AdapterCalls;
import com.autograder.utils.AnswerSegmenter;
import com.autograder.utils.ProcessingEvents;
import com.autograder.utils.ProcessingEvents.Stage;
import com.autograder.utils.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.SortedMap;
import java.util.concurrent.ExecutorService;

/**
 * Grades every answered question of a processed submission and stores one answer/result pair per
 * question. Running it again on an unchanged submission overwrites the same pairs.
 */
public class GradingOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(GradingOrchestrator.class);

    private final SubmissionStore store;
    private final GradingAdapter gradingAdapter;
    private final Duration adapterTimeout;
    private final ExecutorService adapterExecutor;

    public GradingOrchestrator(SubmissionStore store, GradingAdapter gradingAdapter,
                               Duration adapterTimeout, ExecutorService adapterExecutor) {
        this.store = store;
        this.gradingAdapter = gradingAdapter;
        this.adapterTimeout = adapterTimeout;
        this.adapterExecutor = adapterExecutor;
    }

    /**
     * @throws NotFoundException when the submission or its exam does not exist
     */
    public GradingOutcome gradeSubmission(String submissionId) {
        Submission submission = store.findSubmission(submissionId)
                .orElseThrow(() -> NotFoundException.submission(submissionId));

        if (submission.getProcessingStatus() != ProcessingStatus.PROCESSED || !submission.hasText()) {
            ProcessingEvents.info(submissionId, Stage.GRADING,
                    "skipped status=" + submission.getProcessingStatus() + " hasText=" + submission.hasText());
            return GradingOutcome.nothingGraded(submissionId);
        }

        Exam exam = store.findExam(submission.getExamId())
                .orElseThrow(() -> NotFoundException.exam(submission.getExamId()));
        List<Question> questions = store.findQuestionsByExam(exam.id());
        if (questions.isEmpty()) {
            ProcessingEvents.info(submissionId, Stage.GRADING, "skipped reason=no-questions exam=" + exam.id());
            return GradingOutcome.nothingGraded(submissionId);
        }

        SortedMap<Integer, String> answers = AnswerSegmenter.segment(submission.getExtractedText());
        logger.info("🎯 Grading submission {} for exam '{}': {} questions, {} answers found",
                submissionId, exam.name(), questions.size(), answers.size());

        int graded = 0;
        for (Question question : questions) {
            String answer = answers.get(question.questionNumber());
            if (answer == null) {
                logger.debug("No answer for question {} in submission {}", question.questionNumber(), submissionId);
                continue;
            }

            GradeEvaluation evaluation;
            try {
                evaluation = AdapterCalls.callWithTimeout("grading of question " + question.questionNumber(),
                        () -> gradingAdapter.grade(toRequest(question, answer)), adapterTimeout, adapterExecutor);
            } catch (RuntimeException e) {
                ProcessingEvents.failure(submissionId, Stage.GRADING,
                        "question " + question.questionNumber() + ": " + e.getMessage());
                continue;
            }

            if (!persist(submission, question, answer, evaluation)) {
                ProcessingEvents.info(submissionId, Stage.GRADING, "stopped reason=submission-changed");
                return new GradingOutcome(submissionId, questions.size(), graded);
            }
            graded++;
        }

        ProcessingEvents.info(submissionId, Stage.GRADING,
                "completed graded=" + graded + " considered=" + questions.size());
        return new GradingOutcome(submissionId, questions.size(), graded);
    }

    private static GradingRequest toRequest(Question question, String answer) {
        return new GradingRequest(question.questionNumber(), question.text(), question.sampleAnswer(),
                question.markingScheme(), question.maxMarks(), question.keywords(), answer);
    }

    /**
     * @return false when the submission was deleted, is being reprocessed or holds other text now
     */
    private boolean persist(Submission submission, Question question, String answer, GradeEvaluation evaluation) {
        StudentAnswer studentAnswer = new StudentAnswer(null, submission.getId(), question.id(),
                submission.getStudentKey(), answer,
                submission.getConfidenceScore() != null ? submission.getConfidenceScore() : 0.0);

        double marks = evaluation.boundedMarks(question.maxMarks());
        GradingResult result = new GradingResult(null, null, submission.getExamId(),
                submission.getStudentKey(), question.id());
        result.setAiMarks(marks);
        result.setFinalMarks(marks);
        result.setFeedback(evaluation.feedback());
        result.setAiConfidence(evaluation.confidence());
        result.setSimilarityScore(similarity(question, answer));
        result.setReviewedByTeacher(false);
        result.setGradedAt(Instant.now());

        return store.upsertGradedAnswer(studentAnswer, result, submission.getExtractedText()).isPresent();
    }

    static double similarity(Question question, String answer) {
        if (!question.keywords().isEmpty()) {
            return TextSimilarity.keywordCoverage(answer, question.keywords());
        }
        if (question.sampleAnswer() != null && !question.sampleAnswer().isBlank()) {
            return TextSimilarity.wordOverlap(answer, question.sampleAnswer());
        }
        return 0.0;
    }
}
