package com.autograder;

import akka.http.javadsl.model.StatusCodes;
import com.autograder.adapters.LocalFileStorage;
import com.autograder.exceptions.AdapterTimeoutException;
import com.autograder.exceptions.NotFoundException;
import com.autograder.exceptions.SubmissionBusyException;
import com.autograder.exceptions.UnauthorizedException;
import com.autograder.exceptions.ValidationException;
import com.autograder.models.BatchReport;
import com.autograder.models.ProcessingStatus;
import com.autograder.models.Submission;
import com.autograder.models.UploadedFile;
import com.autograder.services.IngestionService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

public class WebServerTest {

    @TempDir
    Path tempDir;

    @Test
    void testErrorStatusMapping() {
        assertEquals(StatusCodes.BAD_REQUEST, WebServer.statusFor(new ValidationException("bad")));
        assertEquals(StatusCodes.BAD_REQUEST, WebServer.statusFor(new IllegalArgumentException("bad")));
        assertEquals(StatusCodes.FORBIDDEN, WebServer.statusFor(new UnauthorizedException("nope")));
        assertEquals(StatusCodes.NOT_FOUND, WebServer.statusFor(NotFoundException.exam("bio-101")));
        assertEquals(StatusCodes.CONFLICT, WebServer.statusFor(new SubmissionBusyException("s-1")));
        assertEquals(StatusCodes.INTERNAL_SERVER_ERROR,
                WebServer.statusFor(new AdapterTimeoutException("grading", Duration.ofSeconds(1))));
    }

    @Test
    void testCompletionExceptionsAreUnwrapped() {
        NotFoundException cause = NotFoundException.submission("s-9");

        Throwable unwrapped = WebServer.unwrap(new CompletionException(new CompletionException(cause)));

        assertSame(cause, unwrapped);
        assertEquals(StatusCodes.NOT_FOUND, WebServer.statusFor(unwrapped));
    }

    @Test
    void testBatchRequestDecodesBase64Files() throws Exception {
        String json = "{\"uploadedBy\":\"teacher-1\",\"studentIds\":[\"STU001\"],\"files\":[{\"fileName\":\"STU001_a.txt\","
                + "\"content\":\"" + Base64.getEncoder().encodeToString("Q1: light".getBytes(StandardCharsets.UTF_8))
                + "\"}]}";

        WebServer.BatchUploadRequest request = WebServer.createObjectMapper()
                .readValue(json, WebServer.BatchUploadRequest.class);
        List<UploadedFile> files = request.toUploadedFiles();

        assertEquals("teacher-1", request.uploadedBy);
        assertEquals(List.of("STU001"), request.studentIdList());
        assertEquals(1, files.size());
        assertEquals("STU001_a.txt", files.get(0).fileName());
        assertEquals("Q1: light", new String(files.get(0).content(), StandardCharsets.UTF_8));
    }

    @Test
    void testUndecodableFilesAreReportedPerItem() {
        WebServer.BatchUploadRequest request = new WebServer.BatchUploadRequest();
        WebServer.FileUpload good = new WebServer.FileUpload();
        good.fileName = "STU001_a.txt";
        good.content = Base64.getEncoder().encodeToString("Q1: light".getBytes(StandardCharsets.UTF_8));
        WebServer.FileUpload garbled = new WebServer.FileUpload();
        garbled.fileName = "STU003_b.txt";
        garbled.content = "%%% not base64 %%%";
        request.uploadedBy = TestData.TEACHER;
        request.studentIds = List.of("STU001", "STU003", "STU001");
        request.files = Arrays.asList(good, garbled, null);

        List<UploadedFile> files = request.toUploadedFiles();
        assertEquals(3, files.size());
        assertFalse(files.get(0).isRejected());
        assertTrue(files.get(1).isRejected());
        assertTrue(files.get(2).isRejected());

        IngestionService ingestion = new IngestionService(TestData.seededStore(),
                new LocalFileStorage(tempDir), submissionId -> { }, Set.of("txt"), 1024);
        BatchReport report = ingestion.submitBatch(TestData.EXAM_ID, files, request.studentIdList(),
                request.uploadedBy);

        assertEquals(3, report.total());
        assertEquals(1, report.succeeded().size());
        assertEquals(2, report.failed().size());
        assertEquals("STU003_b.txt", report.failed().get(0).fileName());
    }

    @Test
    void testSubmissionJsonShape() throws Exception {
        ObjectMapper objectMapper = WebServer.createObjectMapper();
        Submission submission = new Submission("s-1", TestData.EXAM_ID, "s-001", TestData.TEACHER,
                "STU001_a.txt", "bio-101/STU001/x.txt", 42, "txt");
        submission.setCreatedAt(Instant.parse("2024-03-01T10:15:30Z"));
        submission.setProcessingStatus(ProcessingStatus.PROCESSED);

        JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(submission));

        assertEquals("processed", node.get("processingStatus").asText());
        assertEquals("2024-03-01T10:15:30Z", node.get("createdAt").asText());
        assertEquals("s-1", node.get("id").asText());
    }
}
