package com.autograder.services;

import com.autograder.adapters.StorageAdapter;
import com.autograder.exceptions.AutograderException;
import com.autograder.exceptions.NotFoundException;
import com.autograder.exceptions.StorageException;
import com.autograder.exceptions.ValidationException;
import com.autograder.models.BatchReport;
import com.autograder.models.BatchReport.UploadFailure;
import com.autograder.models.BatchReport.UploadSuccess;
import com.autograder.models.Student;
import com.autograder.models.Submission;
import com.autograder.models.UploadedFile;
import com.autograder.store.SubmissionStore;
import com.autograder.utils.AutograderSettings;
import com.autograder.utils.ProcessingEvents;
import com.autograder.utils.ProcessingEvents.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Validates uploaded answer files, stores their bytes, records submissions and queues them for
 * processing. Items are handled independently: one bad file never affects the others.
 */
public class IngestionService {
    private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

    static final String ARCHIVE_FILE_NAME = "upload.zip";
    static final String INVALID_ARCHIVE_NAME = "Invalid filename format. Expected: studentID_filename.ext";

    private final SubmissionStore store;
    private final StorageAdapter storage;
    private final SubmissionQueue queue;
    private final Set<String> allowedExtensions;
    private final long maxFileSize;

    public IngestionService(SubmissionStore store, StorageAdapter storage, SubmissionQueue queue,
                            AutograderSettings settings) {
        this(store, storage, queue, settings.getAllowedExtensions(), settings.getMaxFileSize());
    }

    public IngestionService(SubmissionStore store, StorageAdapter storage, SubmissionQueue queue,
                            Set<String> allowedExtensions, long maxFileSize) {
        this.store = store;
        this.storage = storage;
        this.queue = queue;
        this.allowedExtensions = Set.copyOf(allowedExtensions);
        this.maxFileSize = maxFileSize;
    }

    /**
     * Uploads one file per student; {@code files.get(i)} belongs to {@code studentIdentifiers.get(i)}.
     *
     * @throws ValidationException when the two lists differ in length
     * @throws NotFoundException   when the exam does not exist
     */
    public BatchReport submitBatch(String examId, List<UploadedFile> files, List<String> studentIdentifiers,
                                   String uploadedBy) {
        if (files.size() != studentIdentifiers.size()) {
            throw new ValidationException(String.format(
                    "Number of files (%d) must match number of student IDs (%d)",
                    files.size(), studentIdentifiers.size()));
        }
        requireExam(examId);

        logger.info("📥 Batch upload for exam {} by {}: {} files", examId, uploadedBy, files.size());
        List<UploadSuccess> succeeded = new ArrayList<>();
        List<UploadFailure> failed = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            UploadedFile file = files.get(i);
            String studentIdentifier = studentIdentifiers.get(i);
            if (file == null) {
                failed.add(new UploadFailure(null, studentIdentifier, "No file provided"));
            } else if (file.isRejected()) {
                failed.add(new UploadFailure(file.fileName(), studentIdentifier, file.rejection()));
                logger.warn("Rejected {} for student {}: {}", file.fileName(), studentIdentifier, file.rejection());
            } else {
                ingestItem(examId, file.fileName(), file.content(), studentIdentifier, uploadedBy,
                        succeeded, failed);
            }
        }
        return report(examId, files.size(), succeeded, failed);
    }

    /**
     * Uploads the files of a ZIP archive. The student identifier is the part of each entry's file
     * name before the first underscore ({@code STU001_answers.txt}). Hidden entries and directory
     * entries are ignored.
     *
     * @throws ValidationException when the bytes are not a readable ZIP archive
     * @throws NotFoundException   when the exam does not exist
     */
    public BatchReport submitArchive(String examId, byte[] archiveBytes, String uploadedBy) {
        requireExam(examId);
        if (!looksLikeZip(archiveBytes)) {
            throw new ValidationException("Uploaded file is not a valid ZIP archive");
        }

        Path scratch = createScratchDirectory();
        try {
            Path container = scratch.resolve(ARCHIVE_FILE_NAME);
            Files.write(container, archiveBytes);

            List<UploadFailure> failed = new ArrayList<>();
            unpack(container, scratch, failed);
            List<Path> entries = listEntries(scratch, container);

            logger.info("📦 Archive upload for exam {} by {}: {} entries", examId, uploadedBy,
                    entries.size() + failed.size());
            List<UploadSuccess> succeeded = new ArrayList<>();
            for (Path entry : entries) {
                String fileName = entry.getFileName().toString();
                int separator = fileName.indexOf('_');
                if (separator <= 0) {
                    failed.add(new UploadFailure(fileName, null, INVALID_ARCHIVE_NAME));
                    continue;
                }
                byte[] content;
                try {
                    content = Files.readAllBytes(entry);
                } catch (IOException e) {
                    failed.add(new UploadFailure(fileName, null, "Could not read entry: " + e.getMessage()));
                    continue;
                }
                ingestItem(examId, fileName, content, fileName.substring(0, separator), uploadedBy,
                        succeeded, failed);
            }
            return report(examId, succeeded.size() + failed.size(), succeeded, failed);
        } catch (IOException e) {
            throw new StorageException("Failed to stage archive for exam " + examId, e);
        } finally {
            deleteRecursively(scratch);
        }
    }

    private void requireExam(String examId) {
        if (store.findExam(examId).isEmpty()) {
            throw NotFoundException.exam(examId);
        }
    }

    private BatchReport report(String examId, int total, List<UploadSuccess> succeeded, List<UploadFailure> failed) {
        BatchReport report = new BatchReport(examId, total, succeeded, failed);
        logger.info("✅ {} for exam {} ({} failed)", report.getMessage(), examId, failed.size());
        return report;
    }

    private void ingestItem(String examId, String fileName, byte[] content, String studentIdentifier,
                            String uploadedBy, List<UploadSuccess> succeeded, List<UploadFailure> failed) {
        Submission created;
        try {
            Student student = store.findStudentByIdentifier(studentIdentifier)
                    .orElseThrow(() -> new NotFoundException(
                            "Student with ID '" + studentIdentifier + "' not found in database"));
            String extension = validateFile(fileName, content);
            created = storeAndRecord(examId, student, fileName, content, extension, uploadedBy);
        } catch (AutograderException e) {
            failed.add(new UploadFailure(fileName, studentIdentifier, e.getMessage()));
            logger.warn("Rejected {} for student {}: {}", fileName, studentIdentifier, e.getMessage());
            return;
        } catch (RuntimeException e) {
            failed.add(new UploadFailure(fileName, studentIdentifier, "Unexpected error: " + e.getMessage()));
            logger.error("Unexpected error ingesting {} for student {}", fileName, studentIdentifier, e);
            return;
        }

        succeeded.add(new UploadSuccess(created.getId(), studentIdentifier, fileName));
        ProcessingEvents.info(created.getId(), Stage.INTAKE,
                "created status=" + created.getProcessingStatus() + " file=" + fileName);
        try {
            queue.enqueue(created.getId());
        } catch (RuntimeException e) {
            logger.error("Failed to queue submission {}; it stays uploaded until reprocessed", created.getId(), e);
        }
    }

    /**
     * @return the lower-cased extension of the file
     */
    private String validateFile(String fileName, byte[] content) {
        if (fileName == null || fileName.isBlank()) {
            throw new ValidationException("No filename provided");
        }
        String extension = extensionOf(fileName);
        if (!allowedExtensions.contains(extension)) {
            throw new ValidationException("Invalid file type: " + extension + ". Allowed: "
                    + allowedExtensions.stream().sorted().collect(Collectors.joining(", ")));
        }
        long size = content == null ? 0 : content.length;
        if (size > maxFileSize) {
            throw new ValidationException("File too large: " + size + " bytes (max: " + maxFileSize + ")");
        }
        return extension;
    }

    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private Submission storeAndRecord(String examId, Student student, String fileName, byte[] content,
                                      String extension, String uploadedBy) {
        String submissionId = UUID.randomUUID().toString();
        String storageKey = examId + "/" + student.studentIdentifier() + "/" + UUID.randomUUID() + "." + extension;
        byte[] bytes = content == null ? new byte[0] : content;

        try (OutputStream out = storage.openForWrite(storageKey)) {
            out.write(bytes);
        } catch (IOException e) {
            removeBlob(storageKey);
            throw new StorageException("Failed to store " + fileName, e);
        }

        Submission submission = new Submission(submissionId, examId, student.id(), uploadedBy,
                fileName, storageKey, bytes.length, extension);
        try {
            return store.insertSubmission(submission);
        } catch (RuntimeException e) {
            removeBlob(storageKey);
            throw e;
        }
    }

    private void removeBlob(String storageKey) {
        try {
            storage.delete(storageKey);
        } catch (StorageException e) {
            logger.warn("Could not remove orphaned blob {}: {}", storageKey, e.getMessage());
        }
    }

    private static boolean looksLikeZip(byte[] bytes) {
        return bytes != null && bytes.length >= 4 && bytes[0] == 'P' && bytes[1] == 'K'
                && (bytes[2] == 3 && bytes[3] == 4 || bytes[2] == 5 && bytes[3] == 6);
    }

    private static Path createScratchDirectory() {
        try {
            return Files.createTempDirectory("autograder-upload-");
        } catch (IOException e) {
            throw new StorageException("Failed to create scratch directory", e);
        }
    }

    /**
     * Extracts every regular entry below {@code target}. Entries whose path would leave the
     * target directory, and entries larger than the maximum file size, are reported as failures
     * and not kept. Oversized entries are never written beyond the limit.
     */
    private void unpack(Path archive, Path target, List<UploadFailure> failed) throws IOException {
        try (InputStream in = Files.newInputStream(archive); ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                String name = entry.getName();
                if (entry.isDirectory() || isHidden(name)) {
                    continue;
                }
                Path destination = target.resolve(name).normalize();
                if (!destination.startsWith(target) || destination.equals(target.resolve(ARCHIVE_FILE_NAME))) {
                    failed.add(new UploadFailure(name, null, "Invalid entry path: " + name));
                    continue;
                }
                Files.createDirectories(destination.getParent());
                if (!copyBounded(zip, destination, maxFileSize)) {
                    failed.add(new UploadFailure(destination.getFileName().toString(), null,
                            "File too large: exceeds " + maxFileSize + " bytes"));
                }
            }
        } catch (ZipException e) {
            throw new ValidationException("Uploaded file is not a valid ZIP archive: " + e.getMessage());
        }
    }

    /**
     * Copies at most {@code limit} bytes of the current entry.
     *
     * @return false, with nothing left at {@code destination}, when the entry is longer than {@code limit}
     */
    private static boolean copyBounded(InputStream in, Path destination, long limit) throws IOException {
        long written = 0;
        byte[] buffer = new byte[8192];
        try (OutputStream out = Files.newOutputStream(destination)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                if (written + read > limit) {
                    written = limit + 1;
                    break;
                }
                out.write(buffer, 0, read);
                written += read;
            }
        }
        if (written > limit) {
            Files.deleteIfExists(destination);
            return false;
        }
        return true;
    }

    static boolean isHidden(String entryName) {
        for (String segment : entryName.split("[/\\\\]")) {
            if (segment.startsWith(".") && !segment.equals(".") && !segment.equals("..")
                    || segment.equals("__MACOSX")) {
                return true;
            }
        }
        return false;
    }

    private static List<Path> listEntries(Path scratch, Path container) throws IOException {
        try (Stream<Path> files = Files.walk(scratch)) {
            return files.filter(Files::isRegularFile)
                    .filter(path -> !path.equals(container))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static void deleteRecursively(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    logger.warn("Could not delete scratch file {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            logger.warn("Could not clean up scratch directory {}: {}", directory, e.getMessage());
        }
    }
}
