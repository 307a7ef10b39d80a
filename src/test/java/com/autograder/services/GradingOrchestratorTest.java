package com.autograder.services;

import com.autograder.TestData;
import com.autograder.adapters.GradeEvaluation;
import com.autograder.adapters.GradingAdapter;
import com.autograder.adapters.LocalFileStorage;
import com.autograder.exceptions.GradingAdapterException;
import com.autograder.exceptions.NotFoundException;
import com.autograder.models.Exam;
import com.autograder.models.GradedAnswer;
import com.autograder.models.GradingOutcome;
import com.autograder.models.GradingResult;
import com.autograder.models.ProcessingStatus;
import com.autograder.models.Question;
import com.autograder.models.Student;
import com.autograder.models.Submission;
import com.autograder.store.InMemorySubmissionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class GradingOrchestratorTest {

    @TempDir
    Path tempDir;

    private InMemorySubmissionStore store;
    private LocalFileStorage storage;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        store = TestData.seededStore();
        storage = new LocalFileStorage(tempDir);
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private GradingOrchestrator orchestrator(GradingAdapter adapter) {
        return new GradingOrchestrator(store, adapter, Duration.ofMillis(500), executor);
    }

    private Submission processed(Student student, String text) {
        Submission submission = TestData.uploadedSubmission(store, storage, student, text);
        return store.updateSubmission(submission.getId(), s -> {
            s.setProcessingStatus(ProcessingStatus.PROCESSED);
            s.setExtractedText(text);
            s.setConfidenceScore(0.9);
            return s;
        }).orElseThrow();
    }

    @Test
    void testGradingIsIdempotent() {
        Submission submission = processed(TestData.ALICE, TestData.ANSWER_SHEET);
        GradingOrchestrator orchestrator = orchestrator(request -> new GradeEvaluation(3.0, 0.8, "ok"));

        GradingOutcome first = orchestrator.gradeSubmission(submission.getId());
        Set<String> firstIds = resultIds(submission.getId());
        GradingOutcome second = orchestrator.gradeSubmission(submission.getId());

        assertEquals(2, first.gradedCount());
        assertEquals(first.gradedCount(), second.gradedCount());
        assertEquals(2, store.findGradedAnswersBySubmission(submission.getId()).size());
        assertEquals(firstIds, resultIds(submission.getId()));
    }

    @Test
    void testFailingQuestionDoesNotAbortOthers() {
        Submission submission = processed(TestData.ALICE, TestData.ANSWER_SHEET);
        GradingOrchestrator orchestrator = orchestrator(request -> {
            if (request.questionNumber() == 1) {
                throw new GradingAdapterException("model overloaded");
            }
            return new GradeEvaluation(4.0, 0.7, "fine");
        });

        GradingOutcome outcome = orchestrator.gradeSubmission(submission.getId());

        assertEquals(2, outcome.questionsConsidered());
        assertEquals(1, outcome.gradedCount());
        assertEquals(1, outcome.ungradedCount());
        List<GradedAnswer> stored = store.findGradedAnswersBySubmission(submission.getId());
        assertEquals(1, stored.size());
        assertEquals(TestData.CELL.id(), stored.get(0).result().getQuestionId());
    }

    @Test
    void testSlowQuestionTimesOut() {
        Submission submission = processed(TestData.ALICE, TestData.ANSWER_SHEET);
        GradingOrchestrator orchestrator = orchestrator(request -> {
            if (request.questionNumber() == 2) {
                try {
                    Thread.sleep(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return new GradeEvaluation(1.0, 0.5, "slow");
        });

        GradingOutcome outcome = orchestrator.gradeSubmission(submission.getId());

        assertEquals(1, outcome.gradedCount());
    }

    @Test
    void testUnansweredQuestionIsSkipped() {
        Submission submission = processed(TestData.ALICE, "Q2: mitochondria");

        GradingOutcome outcome = orchestrator(request -> new GradeEvaluation(5.0, 1.0, "good"))
                .gradeSubmission(submission.getId());

        assertEquals(2, outcome.questionsConsidered());
        assertEquals(1, outcome.gradedCount());
        assertEquals(TestData.CELL.id(),
                store.findGradedAnswersBySubmission(submission.getId()).get(0).answer().getQuestionId());
    }

    @Test
    void testResultFields() {
        Submission submission = processed(TestData.ALICE, TestData.ANSWER_SHEET);

        orchestrator(request -> new GradeEvaluation(request.questionNumber() == 1 ? 9.0 : -2.0, 0.8, "fb"))
                .gradeSubmission(submission.getId());

        GradedAnswer q1 = findFor(submission.getId(), TestData.PHOTOSYNTHESIS.id());
        assertEquals("Plants use light and chlorophyll.", q1.answer().getExtractedAnswer());
        assertEquals(0.9, q1.answer().getConfidenceScore());
        GradingResult result = q1.result();
        assertEquals(5.0, result.getAiMarks());
        assertEquals(result.getAiMarks(), result.getFinalMarks());
        assertFalse(result.isReviewedByTeacher());
        assertEquals(1.0, result.getSimilarityScore());
        assertEquals(TestData.EXAM_ID, result.getExamId());
        assertEquals(TestData.ALICE.id(), result.getStudentKey());
        assertEquals(q1.answer().getId(), result.getStudentAnswerId());

        GradingResult q2 = findFor(submission.getId(), TestData.CELL.id()).result();
        assertEquals(0.0, q2.getAiMarks());
        assertTrue(q2.getSimilarityScore() > 0.0);
    }

    @Test
    void testResultsAreDiscardedWhenSubmissionIsReclaimed() {
        Submission submission = processed(TestData.ALICE, TestData.ANSWER_SHEET);
        GradingOrchestrator orchestrator = orchestrator(request -> {
            store.updateSubmission(submission.getId(), s -> {
                s.setProcessingStatus(ProcessingStatus.PROCESSING);
                return s;
            });
            return new GradeEvaluation(3.0, 0.8, "stale");
        });

        GradingOutcome outcome = orchestrator.gradeSubmission(submission.getId());

        assertEquals(0, outcome.gradedCount());
        assertTrue(store.findGradedAnswersBySubmission(submission.getId()).isEmpty());
    }

    @Test
    void testResultsAreDiscardedWhenTextChanged() {
        Submission submission = processed(TestData.ALICE, TestData.ANSWER_SHEET);
        GradingOrchestrator orchestrator = orchestrator(request -> {
            store.updateSubmission(submission.getId(), s -> {
                s.setExtractedText("Q1: rewritten");
                return s;
            });
            return new GradeEvaluation(3.0, 0.8, "stale");
        });

        assertEquals(0, orchestrator.gradeSubmission(submission.getId()).gradedCount());
        assertTrue(store.findGradedAnswersBySubmission(submission.getId()).isEmpty());
    }

    @Test
    void testSubmissionsWithoutTextAreNotGraded() {
        Submission uploaded = TestData.uploadedSubmission(store, storage, TestData.ALICE, TestData.ANSWER_SHEET);
        Submission failed = TestData.uploadedSubmission(store, storage, TestData.CAROL, "");
        store.updateSubmission(failed.getId(), s -> {
            s.setProcessingStatus(ProcessingStatus.FAILED);
            s.setErrorMessage("Text extraction produced no text");
            return s;
        });
        GradingOrchestrator orchestrator = orchestrator(request -> new GradeEvaluation(1.0, 1.0, "x"));

        assertEquals(0, orchestrator.gradeSubmission(uploaded.getId()).gradedCount());
        assertEquals(0, orchestrator.gradeSubmission(failed.getId()).gradedCount());
        assertTrue(store.findGradedAnswersByExam(TestData.EXAM_ID).isEmpty());
    }

    @Test
    void testExamWithoutQuestions() {
        store.saveExam(new Exam("empty-exam", "No questions", 0));
        Submission submission = store.insertSubmission(new Submission("s-empty", "empty-exam", TestData.ALICE.id(),
                TestData.TEACHER, "a.txt", "k", 1, "txt"));
        store.updateSubmission(submission.getId(), s -> {
            s.setProcessingStatus(ProcessingStatus.PROCESSED);
            s.setExtractedText("Q1: something");
            return s;
        });

        GradingOutcome outcome = orchestrator(request -> new GradeEvaluation(1.0, 1.0, "x"))
                .gradeSubmission("s-empty");

        assertEquals(0, outcome.questionsConsidered());
        assertEquals(0, outcome.gradedCount());
    }

    @Test
    void testUnknownSubmission() {
        GradingOrchestrator orchestrator = orchestrator(request -> new GradeEvaluation(1.0, 1.0, "x"));

        assertThrows(NotFoundException.class, () -> orchestrator.gradeSubmission("missing"));
    }

    @Test
    void testSimilarityFallsBackToSampleAnswer() {
        assertEquals(1.0, GradingOrchestrator.similarity(TestData.PHOTOSYNTHESIS, "light and chlorophyll"));
        assertTrue(GradingOrchestrator.similarity(TestData.CELL, "mitochondria produces energy") > 0.5);
        assertEquals(0.0, GradingOrchestrator.similarity(
                new Question("q", "e", 1, "t", 1.0, null, null, Set.of()), "anything"));
    }

    private Set<String> resultIds(String submissionId) {
        return store.findGradedAnswersBySubmission(submissionId).stream()
                .map(g -> g.result().getId())
                .collect(Collectors.toSet());
    }

    private GradedAnswer findFor(String submissionId, String questionId) {
        return store.findGradedAnswersBySubmission(submissionId).stream()
                .filter(g -> g.answer().getQuestionId().equals(questionId))
                .findFirst()
                .orElseThrow();
    }
}
