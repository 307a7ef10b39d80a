package com.autograder;

import akka.actor.typed.ActorSystem;
import akka.http.javadsl.Http;
import akka.http.javadsl.ServerBinding;
import akka.http.javadsl.marshallers.jackson.Jackson;
import akka.http.javadsl.model.ContentTypes;
import akka.http.javadsl.model.HttpResponse;
import akka.http.javadsl.model.StatusCode;
import akka.http.javadsl.model.StatusCodes;
import akka.http.javadsl.server.AllDirectives;
import akka.http.javadsl.server.Route;
import akka.http.javadsl.unmarshalling.Unmarshaller;
import com.autograder.actors.ActorSubmissionQueue;
import com.autograder.exceptions.NotFoundException;
import com.autograder.exceptions.SubmissionBusyException;
import com.autograder.exceptions.UnauthorizedException;
import com.autograder.exceptions.ValidationException;
import com.autograder.models.UploadedFile;
import com.autograder.services.IngestionService;
import com.autograder.services.StatusTracker;
import com.autograder.services.SubmissionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import static akka.http.javadsl.server.PathMatchers.segment;

/**
 * HTTP surface of the autograder. Handlers run the blocking service calls on a separate executor
 * and map service exceptions to status codes with a {@code {"error": ...}} body.
 */
public class WebServer extends AllDirectives {
    private static final Logger logger = LoggerFactory.getLogger(WebServer.class);

    private static final Duration STATS_TIMEOUT = Duration.ofSeconds(3);

    private final ActorSystem<?> system;
    private final IngestionService ingestionService;
    private final StatusTracker statusTracker;
    private final SubmissionService submissionService;
    private final ActorSubmissionQueue submissionQueue;
    private final Executor blockingExecutor;
    private final ObjectMapper objectMapper;

    public WebServer(ActorSystem<?> system, IngestionService ingestionService, StatusTracker statusTracker,
                     SubmissionService submissionService, ActorSubmissionQueue submissionQueue,
                     Executor blockingExecutor) {
        this.system = system;
        this.ingestionService = ingestionService;
        this.statusTracker = statusTracker;
        this.submissionService = submissionService;
        this.submissionQueue = submissionQueue;
        this.blockingExecutor = blockingExecutor;
        this.objectMapper = createObjectMapper();
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public CompletionStage<ServerBinding> startServer(String host, int port) {
        final Http http = Http.get(system);

        return http.newServerAt(host, port)
                .bind(createRoute())
                .thenApply(binding -> {
                    logger.info("🌐 Server online at http://{}:{}/", host, port);
                    return binding;
                });
    }

    Route createRoute() {
        return concat(
            pathPrefix("upload", () -> concat(
                path(segment("batch").slash(segment()), examId ->
                    post(() ->
                        entity(Jackson.unmarshaller(objectMapper, BatchUploadRequest.class), request ->
                            respond(StatusCodes.OK, () -> ingestionService.submitBatch(
                                    examId, request.toUploadedFiles(), request.studentIdList(), request.uploadedBy))
                        )
                    )
                ),
                path(segment("zip").slash(segment()), examId ->
                    post(() ->
                        parameter("uploadedBy", uploadedBy ->
                            entity(Unmarshaller.entityToByteArray(), archive ->
                                respond(StatusCodes.OK, () -> ingestionService.submitArchive(examId, archive, uploadedBy))
                            )
                        )
                    )
                ),
                path(segment("status").slash(segment()), submissionId ->
                    get(() -> respond(StatusCodes.OK, () -> statusTracker.getSubmissionStatus(submissionId)))
                ),
                path(segment("exam").slash(segment()).slash("status"), examId ->
                    get(() -> respond(StatusCodes.OK, () -> statusTracker.examUploadStatus(examId)))
                ),
                path(segment().slash("reprocess"), submissionId ->
                    post(() -> respond(StatusCodes.OK, () -> submissionService.reprocess(submissionId)))
                ),
                path(segment(), submissionId ->
                    delete(() ->
                        parameterOptional("requesterId", requesterId ->
                            respond(StatusCodes.OK, () -> {
                                submissionService.deleteSubmission(submissionId, requesterId.orElse(null));
                                return Map.of("message", "Submission deleted successfully");
                            })
                        )
                    )
                )
            )),

            pathPrefix("exam", () -> concat(
                path(segment().slash("regrade-all"), examId ->
                    post(() -> respond(StatusCodes.OK, () -> submissionService.regradeAll(examId)))
                ),
                path(segment().slash("grading-status"), examId ->
                    get(() -> respond(StatusCodes.OK, () -> statusTracker.examGradingStatus(examId)))
                ),
                path(segment().slash("results.csv"), examId ->
                    get(() -> onComplete(
                        CompletableFuture.supplyAsync(() -> statusTracker.exportGradingResultsCsv(examId), blockingExecutor),
                        tryResult -> tryResult.isSuccess()
                            ? complete(HttpResponse.create()
                                .withStatus(StatusCodes.OK)
                                .withEntity(ContentTypes.TEXT_CSV_UTF8, tryResult.get()))
                            : completeError(tryResult.failed().get())
                    ))
                )
            )),

            path(segment("dispatcher").slash("stats"), () ->
                get(() ->
                    extractRequest(request -> onComplete(submissionQueue.stats(STATS_TIMEOUT), tryResult ->
                        tryResult.isSuccess()
                            ? completeJson(StatusCodes.OK, tryResult.get())
                            : completeError(tryResult.failed().get())
                    ))
                )
            )
        );
    }

    private Route respond(StatusCode successStatus, Supplier<Object> operation) {
        CompletableFuture<Object> result = CompletableFuture.supplyAsync(operation, blockingExecutor);
        return onComplete(result, tryResult -> tryResult.isSuccess()
                ? completeJson(successStatus, tryResult.get())
                : completeError(tryResult.failed().get()));
    }

    private Route completeJson(StatusCode status, Object body) {
        try {
            return complete(HttpResponse.create()
                    .withStatus(status)
                    .withEntity(ContentTypes.APPLICATION_JSON, objectMapper.writeValueAsString(body)));
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize response", e);
            return completeError(e);
        }
    }

    private Route completeError(Throwable failure) {
        Throwable cause = unwrap(failure);
        StatusCode status = statusFor(cause);
        if (status == StatusCodes.INTERNAL_SERVER_ERROR) {
            logger.error("❌ Request failed", cause);
        } else {
            logger.info("Request rejected ({}): {}", status.intValue(), cause.getMessage());
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("error", message));
        } catch (JsonProcessingException e) {
            body = "{\"error\":\"Internal server error\"}";
        }
        return complete(HttpResponse.create()
                .withStatus(status)
                .withEntity(ContentTypes.APPLICATION_JSON, body));
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static StatusCode statusFor(Throwable failure) {
        if (failure instanceof ValidationException || failure instanceof IllegalArgumentException) {
            return StatusCodes.BAD_REQUEST;
        }
        if (failure instanceof UnauthorizedException) {
            return StatusCodes.FORBIDDEN;
        }
        if (failure instanceof NotFoundException) {
            return StatusCodes.NOT_FOUND;
        }
        if (failure instanceof SubmissionBusyException) {
            return StatusCodes.CONFLICT;
        }
        return StatusCodes.INTERNAL_SERVER_ERROR;
    }

    public static class BatchUploadRequest {
        public String uploadedBy;
        public List<String> studentIds;
        public List<FileUpload> files;

        public BatchUploadRequest() {}

        List<String> studentIdList() {
            return studentIds != null ? studentIds : List.of();
        }

        /**
         * Decodes the files in request order. Missing entries and invalid base64 become rejected
         * files so they are reported per item.
         */
        List<UploadedFile> toUploadedFiles() {
            List<UploadedFile> uploaded = new ArrayList<>();
            if (files == null) {
                return uploaded;
            }
            for (FileUpload file : files) {
                if (file == null) {
                    uploaded.add(UploadedFile.rejected(null, "No file provided"));
                    continue;
                }
                try {
                    byte[] content = file.content != null ? Base64.getDecoder().decode(file.content) : new byte[0];
                    uploaded.add(new UploadedFile(file.fileName, content));
                } catch (IllegalArgumentException e) {
                    uploaded.add(UploadedFile.rejected(file.fileName, "File content is not valid base64"));
                }
            }
            return uploaded;
        }
    }

    public static class FileUpload {
        public String fileName;
        public String content;

        public FileUpload() {}
    }
}
