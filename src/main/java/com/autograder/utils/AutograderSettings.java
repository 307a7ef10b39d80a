package com.autograder.utils;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Typed view of the {@code autograder} section of the application configuration
 */
public class AutograderSettings {

    private final Set<String> allowedExtensions;
    private final long maxFileSize;
    private final Path storageRoot;
    private final int workerPoolSize;
    private final Duration adapterTimeout;
    private final String openAIBaseUrl;
    private final String openAIModel;
    private final String httpHost;
    private final int httpPort;
    private final String studentsCsv;
    private final String questionsCsv;

    public AutograderSettings(Config config) {
        Config root = config.getConfig("autograder");
        Config upload = root.getConfig("upload");
        Config processing = root.getConfig("processing");

        this.allowedExtensions = upload.getStringList("allowed-extensions").stream()
                .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .collect(Collectors.toUnmodifiableSet());
        this.maxFileSize = upload.getBytes("max-file-size");
        this.storageRoot = Paths.get(upload.getString("storage-root"));

        this.workerPoolSize = processing.getInt("worker-pool-size");
        if (workerPoolSize < 1) {
            throw new IllegalArgumentException("autograder.processing.worker-pool-size must be at least 1");
        }
        this.adapterTimeout = processing.getDuration("adapter-timeout");

        this.openAIBaseUrl = root.getString("openai.base-url");
        this.openAIModel = root.getString("openai.model");
        this.httpHost = root.getString("http.host");
        this.httpPort = root.getInt("http.port");
        this.studentsCsv = root.hasPath("seed.students-csv") ? root.getString("seed.students-csv") : null;
        this.questionsCsv = root.hasPath("seed.questions-csv") ? root.getString("seed.questions-csv") : null;
    }

    public static AutograderSettings load() {
        return new AutograderSettings(ConfigFactory.load());
    }

    public Set<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public long getMaxFileSize() {
        return maxFileSize;
    }

    public Path getStorageRoot() {
        return storageRoot;
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public Duration getAdapterTimeout() {
        return adapterTimeout;
    }

    public String getOpenAIBaseUrl() {
        return openAIBaseUrl;
    }

    public String getOpenAIModel() {
        return openAIModel;
    }

    public String getHttpHost() {
        return httpHost;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public String getStudentsCsv() {
        return studentsCsv;
    }

    public String getQuestionsCsv() {
        return questionsCsv;
    }
}
