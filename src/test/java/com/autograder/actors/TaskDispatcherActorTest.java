package com.autograder.actors;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.actor.typed.ActorRef;
import akka.actor.typed.DispatcherSelector;
import com.autograder.TestData;
import com.autograder.adapters.ExtractionResult;
import com.autograder.adapters.GradeEvaluation;
import com.autograder.adapters.LocalFileStorage;
import com.autograder.adapters.PlainTextExtractor;
import com.autograder.adapters.TextExtractionAdapter;
import com.autograder.models.ProcessingStatus;
import com.autograder.models.Submission;
import com.autograder.services.GradingOrchestrator;
import com.autograder.services.SubmissionProcessor;
import com.autograder.store.InMemorySubmissionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class TaskDispatcherActorTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private ActorTestKit testKit;
    private InMemorySubmissionStore store;
    private LocalFileStorage storage;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        testKit = ActorTestKit.create();
        store = TestData.seededStore();
        storage = new LocalFileStorage(tempDir);
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        testKit.shutdownTestKit();
        executor.shutdownNow();
    }

    private ActorRef<ProcessingMessages.Message> spawnDispatcher(TextExtractionAdapter extractor, int poolSize) {
        GradingOrchestrator orchestrator = new GradingOrchestrator(store,
                request -> new GradeEvaluation(1.0, 0.9, "ok"), WAIT, executor);
        SubmissionProcessor processor = new SubmissionProcessor(store, storage, extractor, orchestrator,
                WAIT, executor);
        return testKit.spawn(TaskDispatcherActor.create(processor, poolSize, DispatcherSelector.blocking()));
    }

    private ProcessingMessages.DispatcherStats statsOf(ActorRef<ProcessingMessages.Message> dispatcher,
                                                     TestProbe<ProcessingMessages.DispatcherStats> replies) {
        dispatcher.tell(new ProcessingMessages.GetDispatcherStats(replies.ref()));
        return replies.receiveMessage();
    }

    @Test
    void testAtMostPoolSizeSubmissionsRunAtOnce() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        ActorRef<ProcessingMessages.Message> dispatcher = spawnDispatcher((content, format) -> {
            try {
                release.await(WAIT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ExtractionResult.success(new String(content, StandardCharsets.UTF_8), 1.0);
        }, 2);
        TestProbe<ProcessingMessages.DispatcherStats> replies = testKit.createTestProbe();

        List<Submission> submissions = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Submission submission = TestData.uploadedSubmission(store, storage, TestData.ALICE, TestData.ANSWER_SHEET);
            submissions.add(submission);
            dispatcher.tell(new ProcessingMessages.EnqueueSubmission(submission.getId()));
        }

        replies.awaitAssert(WAIT, () -> {
            ProcessingMessages.DispatcherStats stats = statsOf(dispatcher, replies);
            assertEquals(2, stats.getBusy());
            assertEquals(3, stats.getQueued());
            assertEquals(0, stats.getIdle());
            assertEquals(2, submissions.stream()
                    .map(s -> store.findSubmission(s.getId()).orElseThrow().getProcessingStatus())
                    .filter(status -> status == ProcessingStatus.PROCESSING)
                    .count());
            return stats;
        });

        release.countDown();

        replies.awaitAssert(WAIT, () -> {
            ProcessingMessages.DispatcherStats stats = statsOf(dispatcher, replies);
            assertEquals(5, stats.getCompleted());
            assertEquals(0, stats.getQueued());
            assertEquals(2, stats.getIdle());
            return stats;
        });
        for (Submission submission : submissions) {
            assertEquals(ProcessingStatus.PROCESSED,
                    store.findSubmission(submission.getId()).orElseThrow().getProcessingStatus());
            assertEquals(2, store.findGradedAnswersBySubmission(submission.getId()).size());
        }
    }

    @Test
    void testUnknownSubmissionStillFreesTheWorker() {
        ActorRef<ProcessingMessages.Message> dispatcher = spawnDispatcher(new PlainTextExtractor(), 1);
        TestProbe<ProcessingMessages.DispatcherStats> replies = testKit.createTestProbe();
        Submission submission = TestData.uploadedSubmission(store, storage, TestData.CAROL, TestData.ANSWER_SHEET);

        dispatcher.tell(new ProcessingMessages.EnqueueSubmission("no-such-submission"));
        dispatcher.tell(new ProcessingMessages.EnqueueSubmission(submission.getId()));

        replies.awaitAssert(WAIT, () -> {
            ProcessingMessages.DispatcherStats stats = statsOf(dispatcher, replies);
            assertEquals(2, stats.getCompleted());
            assertEquals(1, stats.getIdle());
            return stats;
        });
        assertEquals(ProcessingStatus.PROCESSED,
                store.findSubmission(submission.getId()).orElseThrow().getProcessingStatus());
    }

    @Test
    void testFailedExtractionIsCountedAsCompleted() {
        ActorRef<ProcessingMessages.Message> dispatcher =
                spawnDispatcher((content, format) -> ExtractionResult.failure("blurry"), 2);
        TestProbe<ProcessingMessages.DispatcherStats> replies = testKit.createTestProbe();
        Submission submission = TestData.uploadedSubmission(store, storage, TestData.ALICE, TestData.ANSWER_SHEET);

        dispatcher.tell(new ProcessingMessages.EnqueueSubmission(submission.getId()));

        replies.awaitAssert(WAIT, () -> {
            assertEquals(1, statsOf(dispatcher, replies).getCompleted());
            return null;
        });
        Submission failed = store.findSubmission(submission.getId()).orElseThrow();
        assertEquals(ProcessingStatus.FAILED, failed.getProcessingStatus());
        assertEquals("Text extraction failed: blurry", failed.getErrorMessage());
    }

    @Test
    void testQueueForwardsToDispatcher() throws Exception {
        ActorRef<ProcessingMessages.Message> dispatcher = spawnDispatcher(new PlainTextExtractor(), 3);
        ActorSubmissionQueue queue = new ActorSubmissionQueue(dispatcher, testKit.scheduler());
        Submission submission = TestData.uploadedSubmission(store, storage, TestData.ALICE, TestData.ANSWER_SHEET);

        queue.enqueue(submission.getId());

        TestProbe<ProcessingMessages.DispatcherStats> replies = testKit.createTestProbe();
        replies.awaitAssert(WAIT, () -> {
            assertEquals(1, statsOf(dispatcher, replies).getCompleted());
            return null;
        });
        ProcessingMessages.DispatcherStats stats = queue.stats(Duration.ofSeconds(3))
                .toCompletableFuture()
                .get(5, TimeUnit.SECONDS);
        assertEquals(3, stats.getPoolSize());
        assertEquals(3, stats.getIdle());
        assertEquals(0, stats.getBusy());
    }

    @Test
    void testPoolSizeMustBePositive() {
        SubmissionProcessor processor = new SubmissionProcessor(store, storage, new PlainTextExtractor(),
                new GradingOrchestrator(store, request -> new GradeEvaluation(0, 0, ""), WAIT, executor),
                WAIT, executor);

        assertThrows(IllegalArgumentException.class, () -> TaskDispatcherActor.create(processor, 0));
    }
}
