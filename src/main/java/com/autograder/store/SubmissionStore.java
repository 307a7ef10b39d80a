package com.autograder.store;

import com.autograder.models.Exam;
import com.autograder.models.GradedAnswer;
import com.autograder.models.GradingResult;
import com.autograder.models.ProcessingStatus;
import com.autograder.models.Question;
import com.autograder.models.Student;
import com.autograder.models.StudentAnswer;
import com.autograder.models.Submission;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Persistent store used by the pipeline. Implementations guarantee atomic single-row updates;
 * everything returned is a snapshot that callers may modify freely.
 */
public interface SubmissionStore {

    // Reference data

    void saveExam(Exam exam);

    void saveQuestion(Question question);

    void saveStudent(Student student);

    Optional<Exam> findExam(String examId);

    /**
     * @return questions of the exam in ascending question number
     */
    List<Question> findQuestionsByExam(String examId);

    Optional<Student> findStudentByIdentifier(String studentIdentifier);

    /**
     * Batch lookup by internal student key; unknown keys are simply absent from the result.
     */
    Map<String, Student> findStudentsByKeys(Collection<String> studentKeys);

    // Submissions

    Submission insertSubmission(Submission submission);

    Optional<Submission> findSubmission(String submissionId);

    /**
     * Atomically applies {@code update} to a copy of the row and stores the returned value.
     *
     * @return the stored row, or empty if the submission does not exist (anymore)
     */
    Optional<Submission> updateSubmission(String submissionId, UnaryOperator<Submission> update);

    /**
     * Removes the submission together with its answers and results, unless {@code guard} rejects it.
     *
     * @return the removed row; empty if it did not exist or the guard rejected it
     */
    Optional<Submission> deleteSubmission(String submissionId, Predicate<Submission> guard);

    /**
     * @return submissions of the exam, newest first
     */
    List<Submission> findSubmissionsByExam(String examId);

    List<Submission> findSubmissionsByExamAndStatus(String examId, ProcessingStatus status);

    // Answers and grading results

    /**
     * Inserts the pair for (answer.submissionId, answer.questionId), or replaces the fields of the
     * existing pair while keeping its ids. The write only happens while the submission is
     * {@code processed} and its extracted text still equals {@code gradedText}.
     *
     * @return the stored pair, or empty if the submission no longer exists or its text changed
     */
    Optional<GradedAnswer> upsertGradedAnswer(StudentAnswer answer, GradingResult result, String gradedText);

    /**
     * Removes every answer and result of the submission.
     *
     * @return number of pairs removed; 0 also when the submission does not exist
     */
    int deleteGradedAnswers(String submissionId);

    List<GradedAnswer> findGradedAnswersBySubmission(String submissionId);

    List<GradedAnswer> findGradedAnswersByExam(String examId);

    /**
     * @return submission id to number of student answers, for every requested id
     */
    Map<String, Integer> countStudentAnswersBySubmission(Collection<String> submissionIds);

    /**
     * @return submission id to number of grading results, for every requested id
     */
    Map<String, Integer> countGradingResultsBySubmission(Collection<String> submissionIds);

    /**
     * @return student key to number of grading results recorded for the exam
     */
    Map<String, Integer> countGradingResultsByStudent(String examId);
}
