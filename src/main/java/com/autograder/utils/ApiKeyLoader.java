package com.autograder.utils;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the OpenAI API key used by the grading client.
 * Priority: 1. environment, 2. .env file in the working directory, 3. {@code autograder.openai.api-key}.
 */
public class ApiKeyLoader {
    private static final Logger logger = LoggerFactory.getLogger(ApiKeyLoader.class);

    static final String KEY_NAME = "OPENAI_API_KEY";
    private static final String PLACEHOLDER = "your-openai-api-key-here";

    private final Map<String, String> environment;
    private final Path dotEnvPath;

    public ApiKeyLoader() {
        this(System.getenv(), Path.of(".env"));
    }

    ApiKeyLoader(Map<String, String> environment, Path dotEnvPath) {
        this.environment = environment;
        this.dotEnvPath = dotEnvPath;
    }

    /**
     * @return the key, or empty when none of the sources holds a usable one
     */
    public Optional<String> loadOpenAIKey(Config config) {
        String apiKey = environment.get(KEY_NAME);
        if (isUsable(apiKey)) {
            logger.info("Using OpenAI API key from environment variable");
            return Optional.of(apiKey.trim());
        }

        apiKey = loadFromDotEnv();
        if (isUsable(apiKey)) {
            logger.info("Using OpenAI API key from .env file");
            return Optional.of(apiKey.trim());
        }

        if (config.hasPath("autograder.openai.api-key")) {
            apiKey = config.getString("autograder.openai.api-key");
            if (isUsable(apiKey)) {
                logger.info("Using OpenAI API key from configuration");
                return Optional.of(apiKey.trim());
            }
        }

        logger.warn("No valid OpenAI API key found");
        return Optional.empty();
    }

    private static boolean isUsable(String apiKey) {
        return apiKey != null && !apiKey.isBlank() && !PLACEHOLDER.equals(apiKey.trim());
    }

    private String loadFromDotEnv() {
        if (!Files.exists(dotEnvPath)) {
            return null;
        }
        try {
            for (String rawLine : Files.readAllLines(dotEnvPath)) {
                String line = rawLine.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                if (line.startsWith("export ")) line = line.substring(7).trim();
                int eq = line.indexOf('=');
                if (eq <= 0 || !line.substring(0, eq).trim().equals(KEY_NAME)) continue;

                String value = line.substring(eq + 1).trim();
                if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"")
                        || value.startsWith("'") && value.endsWith("'"))) {
                    value = value.substring(1, value.length() - 1);
                }
                return value;
            }
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", dotEnvPath, e.getMessage());
        }
        return null;
    }
}
