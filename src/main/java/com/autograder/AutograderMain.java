package com.autograder;

import akka.actor.typed.ActorSystem;
import com.autograder.actors.ActorSubmissionQueue;
import com.autograder.actors.ProcessingMessages;
import com.autograder.actors.TaskDispatcherActor;
import com.autograder.adapters.GradingAdapter;
import com.autograder.adapters.HeuristicGradingClient;
import com.autograder.adapters.LocalFileStorage;
import com.autograder.adapters.OpenAIGradingClient;
import com.autograder.adapters.PlainTextExtractor;
import com.autograder.adapters.StorageAdapter;
import com.autograder.services.GradingOrchestrator;
import com.autograder.services.IngestionService;
import com.autograder.services.StatusTracker;
import com.autograder.services.SubmissionProcessor;
import com.autograder.services.SubmissionService;
import com.autograder.store.InMemorySubmissionStore;
import com.autograder.store.SubmissionStore;
import com.autograder.utils.ApiKeyLoader;
import com.autograder.utils.AutograderSettings;
import com.autograder.utils.CsvUtils;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main application class: wires the store, adapters, processing pool and HTTP server
 */
public class AutograderMain {
    private static final Logger logger = LoggerFactory.getLogger(AutograderMain.class);

    public static void main(String[] args) {
        System.out.println("╔══════════════════════════════════════════════════════════════╗");
        System.out.println("║                        AUTOGRADER                            ║");
        System.out.println("║           Exam submission intake and grading service         ║");
        System.out.println("╚══════════════════════════════════════════════════════════════╝");
        System.out.println();

        Config config = ConfigFactory.load();
        AutograderSettings settings = new AutograderSettings(config);

        SubmissionStore store = new InMemorySubmissionStore();
        seedStore(store, settings);

        StorageAdapter storage = new LocalFileStorage(settings.getStorageRoot());
        GradingAdapter gradingAdapter = createGradingAdapter(config, settings);
        // one adapter call in flight per worker
        ExecutorService adapterExecutor = Executors.newFixedThreadPool(settings.getWorkerPoolSize());
        ExecutorService requestExecutor = Executors.newCachedThreadPool();

        GradingOrchestrator gradingOrchestrator = new GradingOrchestrator(
                store, gradingAdapter, settings.getAdapterTimeout(), adapterExecutor);
        SubmissionProcessor processor = new SubmissionProcessor(store, storage, new PlainTextExtractor(),
                gradingOrchestrator, settings.getAdapterTimeout(), adapterExecutor);

        ActorSystem<ProcessingMessages.Message> system = ActorSystem.create(
                TaskDispatcherActor.create(processor, settings.getWorkerPoolSize()), "autograder", config);
        system.getWhenTerminated().thenRun(() -> {
            adapterExecutor.shutdownNow();
            requestExecutor.shutdownNow();
        });
        Runtime.getRuntime().addShutdownHook(new Thread(system::terminate, "autograder-shutdown"));

        ActorSubmissionQueue queue = new ActorSubmissionQueue(system, system.scheduler());
        IngestionService ingestionService = new IngestionService(store, storage, queue, settings);
        StatusTracker statusTracker = new StatusTracker(store);
        SubmissionService submissionService = new SubmissionService(store, storage, processor, gradingOrchestrator);

        WebServer server = new WebServer(system, ingestionService, statusTracker, submissionService, queue,
                requestExecutor);
        server.startServer(settings.getHttpHost(), settings.getHttpPort())
                .whenComplete((binding, failure) -> {
                    if (failure != null) {
                        logger.error("❌ Failed to start server", failure);
                        system.terminate();
                    } else {
                        System.out.println("✅ Autograder started: " + settings.getWorkerPoolSize()
                                + " workers, storage at " + settings.getStorageRoot().toAbsolutePath());
                        System.out.println("⏹️  Press Ctrl+C to stop the server...");
                    }
                });
    }

    static GradingAdapter createGradingAdapter(Config config, AutograderSettings settings) {
        Optional<String> apiKey = new ApiKeyLoader().loadOpenAIKey(config);
        if (apiKey.isEmpty()) {
            logger.warn("No valid OpenAI API key found, using heuristic grader");
            return new HeuristicGradingClient();
        }
        logger.info("Using OpenAI model {} for grading", settings.getOpenAIModel());
        return new OpenAIGradingClient(apiKey.get(), settings.getOpenAIBaseUrl(), settings.getOpenAIModel(),
                settings.getAdapterTimeout());
    }

    static void seedStore(SubmissionStore store, AutograderSettings settings) {
        if (settings.getStudentsCsv() != null) {
            try (Reader reader = CsvUtils.openReader(settings.getStudentsCsv())) {
                CsvUtils.readStudents(reader).forEach(store::saveStudent);
            } catch (IOException e) {
                logger.error("Failed to load student roster from {}: {}", settings.getStudentsCsv(), e.getMessage());
            }
        }
        if (settings.getQuestionsCsv() != null) {
            try (Reader reader = CsvUtils.openReader(settings.getQuestionsCsv())) {
                CsvUtils.QuestionBank bank = CsvUtils.readQuestionBank(reader);
                bank.exams().forEach(store::saveExam);
                bank.questions().forEach(store::saveQuestion);
            } catch (IOException e) {
                logger.error("Failed to load question bank from {}: {}", settings.getQuestionsCsv(), e.getMessage());
            }
        }
    }
}
