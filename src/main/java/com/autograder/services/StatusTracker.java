package com.autograder.services;

import com.autograder.exceptions.AutograderException;
import com.autograder.exceptions.NotFoundException;
import com.autograder.models.GradedAnswer;
import com.autograder.models.GradingStatusEntry;
import com.autograder.models.Question;
import com.autograder.models.Student;
import com.autograder.models.Submission;
import com.autograder.models.UploadStatusEntry;
import com.autograder.store.SubmissionStore;
import com.autograder.utils.CsvUtils;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only progress views over the submissions of an exam. Each view costs a fixed number of
 * store calls, independent of the number of submissions.
 */
public class StatusTracker {

    private final SubmissionStore store;

    public StatusTracker(SubmissionStore store) {
        this.store = store;
    }

    public Submission getSubmissionStatus(String submissionId) {
        return store.findSubmission(submissionId)
                .orElseThrow(() -> NotFoundException.submission(submissionId));
    }

    /**
     * Submissions of the exam, newest first, with the roster details of their students
     */
    public List<UploadStatusEntry> examUploadStatus(String examId) {
        requireExam(examId);
        List<Submission> submissions = store.findSubmissionsByExam(examId);
        Map<String, Student> students = store.findStudentsByKeys(studentKeys(submissions));

        return submissions.stream()
                .map(s -> {
                    Student student = students.get(s.getStudentKey());
                    return new UploadStatusEntry(s,
                            student != null ? student.studentIdentifier() : null,
                            student != null ? student.fullName() : null);
                })
                .collect(Collectors.toList());
    }

    /**
     * Grading progress per submission.
     *
     * <p>{@code graded} is true as soon as the student has at least one grading result for the
     * exam. {@code fullyGraded} additionally requires a result for every question of the exam on
     * this very submission.
     */
    public List<GradingStatusEntry> examGradingStatus(String examId) {
        requireExam(examId);
        List<Submission> submissions = store.findSubmissionsByExam(examId);
        List<String> submissionIds = submissions.stream().map(Submission::getId).collect(Collectors.toList());

        Map<String, Student> students = store.findStudentsByKeys(studentKeys(submissions));
        Map<String, Integer> answerCounts = store.countStudentAnswersBySubmission(submissionIds);
        Map<String, Integer> resultCounts = store.countGradingResultsBySubmission(submissionIds);
        Map<String, Integer> resultsByStudent = store.countGradingResultsByStudent(examId);
        int questionCount = store.findQuestionsByExam(examId).size();

        return submissions.stream()
                .map(s -> {
                    Student student = students.get(s.getStudentKey());
                    int results = resultCounts.getOrDefault(s.getId(), 0);
                    return new GradingStatusEntry(
                            s.getId(),
                            s.getStudentKey(),
                            student != null ? student.fullName() : null,
                            s.getProcessingStatus(),
                            s.hasText(),
                            answerCounts.getOrDefault(s.getId(), 0),
                            results,
                            resultsByStudent.getOrDefault(s.getStudentKey(), 0) > 0,
                            questionCount > 0 && results >= questionCount);
                })
                .collect(Collectors.toList());
    }

    /**
     * All grading results of the exam as CSV, one row per (student, question)
     */
    public String exportGradingResultsCsv(String examId) {
        requireExam(examId);
        List<GradedAnswer> graded = store.findGradedAnswersByExam(examId);
        Map<String, Student> students = store.findStudentsByKeys(graded.stream()
                .map(g -> g.result().getStudentKey())
                .collect(Collectors.toSet()));
        Map<String, Question> questions = store.findQuestionsByExam(examId).stream()
                .collect(Collectors.toMap(Question::id, Function.identity()));

        StringWriter csv = new StringWriter();
        try {
            CsvUtils.writeGradingResults(csv, graded, students, questions);
        } catch (IOException e) {
            throw new AutograderException("Failed to export grading results of exam " + examId, e);
        }
        return csv.toString();
    }

    private void requireExam(String examId) {
        if (store.findExam(examId).isEmpty()) {
            throw NotFoundException.exam(examId);
        }
    }

    private static Set<String> studentKeys(List<Submission> submissions) {
        return submissions.stream().map(Submission::getStudentKey).collect(Collectors.toSet());
    }
}
