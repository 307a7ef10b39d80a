package com.autograder.utils;

import com.autograder.models.Exam;
import com.autograder.models.GradedAnswer;
import com.autograder.models.GradingResult;
import com.autograder.models.Question;
import com.autograder.models.Student;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Utility class for CSV file operations: roster and question bank seed files, and grading exports
 */
public class CsvUtils {
    private static final Logger logger = LoggerFactory.getLogger(CsvUtils.class);

    private static final CSVFormat HEADER_FORMAT = CSVFormat.DEFAULT.withFirstRecordAsHeader().withTrim();

    static final String[] RESULT_HEADER = {
            "StudentID", "StudentName", "SubmissionID", "QuestionNumber", "AiMarks", "FinalMarks",
            "MaxMarks", "AiConfidence", "SimilarityScore", "ReviewedByTeacher", "GradedAt", "Feedback"
    };

    /**
     * Exams and questions read from one question bank file
     */
    public record QuestionBank(List<Exam> exams, List<Question> questions) {
    }

    /**
     * Opens a file path, falling back to a classpath resource of the same name
     */
    public static Reader openReader(String location) throws IOException {
        Path path = Path.of(location);
        if (Files.isRegularFile(path)) {
            return Files.newBufferedReader(path, StandardCharsets.UTF_8);
        }
        InputStream resource = CsvUtils.class.getClassLoader().getResourceAsStream(location);
        if (resource == null) {
            throw new FileNotFoundException("No file or classpath resource named " + location);
        }
        return new InputStreamReader(resource, StandardCharsets.UTF_8);
    }

    /**
     * Read the student roster ({@code StudentKey,StudentId,FullName})
     */
    public static List<Student> readStudents(Reader reader) throws IOException {
        List<Student> students = new ArrayList<>();
        try (CSVParser csvParser = new CSVParser(reader, HEADER_FORMAT)) {
            for (CSVRecord record : csvParser) {
                String key = record.get("StudentKey");
                String identifier = record.get("StudentId");
                if (key.isEmpty() || identifier.isEmpty()) {
                    logger.warn("Skipping roster line {}: missing key or student id", record.getRecordNumber());
                    continue;
                }
                students.add(new Student(key, identifier, record.get("FullName")));
            }
        }
        logger.info("Loaded {} students", students.size());
        return students;
    }

    /**
     * Read a question bank, one question per line with its exam repeated on every line.
     * Keywords are separated by semicolons.
     */
    public static QuestionBank readQuestionBank(Reader reader) throws IOException {
        Map<String, Exam> exams = new LinkedHashMap<>();
        List<Question> questions = new ArrayList<>();

        try (CSVParser csvParser = new CSVParser(reader, HEADER_FORMAT)) {
            for (CSVRecord record : csvParser) {
                try {
                    String examId = record.get("ExamId");
                    exams.computeIfAbsent(examId, id -> new Exam(id, record.get("ExamName"),
                            Double.parseDouble(record.get("TotalMarks"))));

                    questions.add(new Question(
                            record.get("QuestionId"),
                            examId,
                            Integer.parseInt(record.get("QuestionNumber")),
                            record.get("QuestionText"),
                            Double.parseDouble(record.get("MaxMarks")),
                            emptyToNull(record.get("MarkingScheme")),
                            emptyToNull(record.get("SampleAnswer")),
                            parseKeywords(record.get("Keywords"))));
                } catch (NumberFormatException e) {
                    logger.error("Error parsing question bank record {}: {}", record.getRecordNumber(), e.getMessage());
                }
            }
        }

        logger.info("Loaded {} exams with {} questions", exams.size(), questions.size());
        return new QuestionBank(new ArrayList<>(exams.values()), questions);
    }

    static Set<String> parseKeywords(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(raw.split(";"))
                .map(String::trim)
                .filter(k -> !k.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Write one row per grading result, ordered by student and question number
     */
    public static void writeGradingResults(Writer writer, List<GradedAnswer> gradedAnswers,
                                           Map<String, Student> studentsByKey,
                                           Map<String, Question> questionsById) throws IOException {
        List<GradedAnswer> ordered = new ArrayList<>(gradedAnswers);
        ordered.sort(Comparator
                .comparing((GradedAnswer g) -> studentIdentifier(studentsByKey, g.result().getStudentKey()))
                .thenComparingInt(g -> questionNumber(questionsById, g.result().getQuestionId())));

        try (CSVPrinter csvPrinter = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
            csvPrinter.printRecord((Object[]) RESULT_HEADER);

            for (GradedAnswer graded : ordered) {
                GradingResult result = graded.result();
                Student student = studentsByKey.get(result.getStudentKey());
                Question question = questionsById.get(result.getQuestionId());

                List<String> row = new ArrayList<>();
                row.add(studentIdentifier(studentsByKey, result.getStudentKey()));
                row.add(student != null ? student.fullName() : "");
                row.add(graded.answer().getSubmissionId());
                row.add(question != null ? String.valueOf(question.questionNumber()) : "");
                row.add(String.valueOf(result.getAiMarks()));
                row.add(String.valueOf(result.getFinalMarks()));
                row.add(question != null ? String.valueOf(question.maxMarks()) : "");
                row.add(String.format(Locale.ROOT, "%.2f", result.getAiConfidence()));
                row.add(String.format(Locale.ROOT, "%.2f", result.getSimilarityScore()));
                row.add(String.valueOf(result.isReviewedByTeacher()));
                row.add(result.getGradedAt() != null ? result.getGradedAt().toString() : "");
                row.add(result.getFeedback() != null ? result.getFeedback().replace("\n", " ") : "");
                csvPrinter.printRecord(row);
            }
        }
        logger.info("Wrote {} grading results", ordered.size());
    }

    private static String studentIdentifier(Map<String, Student> studentsByKey, String studentKey) {
        Student student = studentsByKey.get(studentKey);
        return student != null ? student.studentIdentifier() : studentKey;
    }

    private static int questionNumber(Map<String, Question> questionsById, String questionId) {
        Question question = questionsById.get(questionId);
        return question != null ? question.questionNumber() : Integer.MAX_VALUE;
    }
}
