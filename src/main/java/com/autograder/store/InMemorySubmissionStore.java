package com.autograder.store;

import com.autograder.models.Exam;
import com.autograder.models.GradedAnswer;
import com.autograder.models.GradingResult;
import com.autograder.models.ProcessingStatus;
import com.autograder.models.Question;
import com.autograder.models.Student;
import com.autograder.models.StudentAnswer;
import com.autograder.models.Submission;
import com.autograder.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * {@link SubmissionStore} backed by concurrent maps.
 *
 * <p>Writes to the answers of a submission run while holding that submission's map entry
 * (via {@code computeIfPresent}), so they are serialised with status updates and deletion of the
 * same submission: once a submission is deleted no answer or result can be written for it.
 */
public class InMemorySubmissionStore implements SubmissionStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemorySubmissionStore.class);

    private final Map<String, Exam> exams = new ConcurrentHashMap<>();
    private final Map<String, Question> questions = new ConcurrentHashMap<>();
    private final Map<String, Student> studentsByKey = new ConcurrentHashMap<>();
    private final Map<String, String> studentKeysByIdentifier = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, StoredSubmission> submissions = new ConcurrentHashMap<>();
    private final Map<AnswerKey, GradedAnswer> gradedAnswers = new ConcurrentHashMap<>();
    private final AtomicLong insertSequence = new AtomicLong();

    private record AnswerKey(String submissionId, String questionId) {
    }

    private record StoredSubmission(Submission row, long sequence) {
        StoredSubmission with(Submission updated) {
            return new StoredSubmission(updated, sequence);
        }
    }

    @Override
    public void saveExam(Exam exam) {
        exams.put(exam.id(), exam);
    }

    @Override
    public void saveQuestion(Question question) {
        questions.put(question.id(), question);
    }

    @Override
    public void saveStudent(Student student) {
        studentsByKey.put(student.id(), student);
        studentKeysByIdentifier.put(student.studentIdentifier(), student.id());
    }

    @Override
    public Optional<Exam> findExam(String examId) {
        return Optional.ofNullable(exams.get(examId));
    }

    @Override
    public List<Question> findQuestionsByExam(String examId) {
        return questions.values().stream()
                .filter(q -> q.examId().equals(examId))
                .sorted(Comparator.comparingInt(Question::questionNumber))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Student> findStudentByIdentifier(String studentIdentifier) {
        if (studentIdentifier == null) {
            return Optional.empty();
        }
        String key = studentKeysByIdentifier.get(studentIdentifier);
        return key == null ? Optional.empty() : Optional.ofNullable(studentsByKey.get(key));
    }

    @Override
    public Map<String, Student> findStudentsByKeys(Collection<String> studentKeys) {
        Map<String, Student> found = new HashMap<>();
        for (String key : studentKeys) {
            Student student = studentsByKey.get(key);
            if (student != null) {
                found.put(key, student);
            }
        }
        return found;
    }

    @Override
    public Submission insertSubmission(Submission submission) {
        Objects.requireNonNull(submission.getId(), "submission id");
        if (!exams.containsKey(submission.getExamId())) {
            throw new ValidationException("Unknown exam: " + submission.getExamId());
        }
        if (!studentsByKey.containsKey(submission.getStudentKey())) {
            throw new ValidationException("Unknown student: " + submission.getStudentKey());
        }
        StoredSubmission stored = new StoredSubmission(new Submission(submission), insertSequence.incrementAndGet());
        if (submissions.putIfAbsent(submission.getId(), stored) != null) {
            throw new ValidationException("Duplicate submission id: " + submission.getId());
        }
        logger.debug("Inserted submission {}", submission.getId());
        return new Submission(submission);
    }

    @Override
    public Optional<Submission> findSubmission(String submissionId) {
        StoredSubmission stored = submissions.get(submissionId);
        return stored == null ? Optional.empty() : Optional.of(new Submission(stored.row()));
    }

    @Override
    public Optional<Submission> updateSubmission(String submissionId, UnaryOperator<Submission> update) {
        StoredSubmission updated = submissions.computeIfPresent(submissionId, (id, current) -> {
            Submission next = update.apply(new Submission(current.row()));
            return current.with(new Submission(Objects.requireNonNull(next, "updated submission")));
        });
        return updated == null ? Optional.empty() : Optional.of(new Submission(updated.row()));
    }

    @Override
    public Optional<Submission> deleteSubmission(String submissionId, Predicate<Submission> guard) {
        AtomicReference<Submission> removed = new AtomicReference<>();
        submissions.computeIfPresent(submissionId, (id, current) -> {
            if (!guard.test(new Submission(current.row()))) {
                return current;
            }
            gradedAnswers.keySet().removeIf(key -> key.submissionId().equals(id));
            removed.set(current.row());
            return null;
        });
        return Optional.ofNullable(removed.get());
    }

    @Override
    public List<Submission> findSubmissionsByExam(String examId) {
        return submissions.values().stream()
                .filter(s -> s.row().getExamId().equals(examId))
                .sorted(Comparator.comparing((StoredSubmission s) -> s.row().getCreatedAt())
                        .thenComparingLong(StoredSubmission::sequence)
                        .reversed())
                .map(s -> new Submission(s.row()))
                .collect(Collectors.toList());
    }

    @Override
    public List<Submission> findSubmissionsByExamAndStatus(String examId, ProcessingStatus status) {
        return findSubmissionsByExam(examId).stream()
                .filter(s -> s.getProcessingStatus() == status)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<GradedAnswer> upsertGradedAnswer(StudentAnswer answer, GradingResult result, String gradedText) {
        AnswerKey key = new AnswerKey(answer.getSubmissionId(), answer.getQuestionId());
        AtomicReference<GradedAnswer> stored = new AtomicReference<>();

        submissions.computeIfPresent(key.submissionId(), (id, current) -> {
            Submission row = current.row();
            if (row.getProcessingStatus() != ProcessingStatus.PROCESSED
                    || !Objects.equals(row.getExtractedText(), gradedText)) {
                logger.debug("Rejected answer for submission {}: status={} or text changed",
                        id, row.getProcessingStatus());
                return current;
            }
            GradedAnswer written = gradedAnswers.compute(key, (k, existing) -> {
                StudentAnswer newAnswer = new StudentAnswer(answer);
                GradingResult newResult = new GradingResult(result);
                newAnswer.setId(existing != null ? existing.answer().getId() : UUID.randomUUID().toString());
                newResult.setId(existing != null ? existing.result().getId() : UUID.randomUUID().toString());
                newResult.setStudentAnswerId(newAnswer.getId());
                newResult.setQuestionId(key.questionId());
                return new GradedAnswer(newAnswer, newResult);
            });
            stored.set(copy(written));
            return current;
        });
        return Optional.ofNullable(stored.get());
    }

    @Override
    public int deleteGradedAnswers(String submissionId) {
        AtomicInteger removed = new AtomicInteger();
        submissions.computeIfPresent(submissionId, (id, current) -> {
            gradedAnswers.keySet().removeIf(key -> {
                boolean match = key.submissionId().equals(id);
                if (match) {
                    removed.incrementAndGet();
                }
                return match;
            });
            return current;
        });
        return removed.get();
    }

    @Override
    public List<GradedAnswer> findGradedAnswersBySubmission(String submissionId) {
        return gradedAnswers.entrySet().stream()
                .filter(e -> e.getKey().submissionId().equals(submissionId))
                .map(e -> copy(e.getValue()))
                .collect(Collectors.toList());
    }

    @Override
    public List<GradedAnswer> findGradedAnswersByExam(String examId) {
        return gradedAnswers.values().stream()
                .filter(g -> examId.equals(g.result().getExamId()))
                .map(InMemorySubmissionStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public Map<String, Integer> countStudentAnswersBySubmission(Collection<String> submissionIds) {
        // every stored answer has exactly one result, so both counts come from the same pairs
        return countBySubmission(submissionIds);
    }

    @Override
    public Map<String, Integer> countGradingResultsBySubmission(Collection<String> submissionIds) {
        return countBySubmission(submissionIds);
    }

    @Override
    public Map<String, Integer> countGradingResultsByStudent(String examId) {
        Map<String, Integer> counts = new HashMap<>();
        for (GradedAnswer graded : gradedAnswers.values()) {
            GradingResult result = graded.result();
            if (examId.equals(result.getExamId())) {
                counts.merge(result.getStudentKey(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private Map<String, Integer> countBySubmission(Collection<String> submissionIds) {
        Map<String, Integer> counts = new HashMap<>();
        for (String id : submissionIds) {
            counts.put(id, 0);
        }
        for (AnswerKey key : new ArrayList<>(gradedAnswers.keySet())) {
            counts.computeIfPresent(key.submissionId(), (id, n) -> n + 1);
        }
        return counts;
    }

    private static GradedAnswer copy(GradedAnswer graded) {
        return new GradedAnswer(new StudentAnswer(graded.answer()), new GradingResult(graded.result()));
    }
}
