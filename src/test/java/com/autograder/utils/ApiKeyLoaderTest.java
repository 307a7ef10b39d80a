package com.autograder.utils;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ApiKeyLoaderTest {

    @TempDir
    Path tempDir;

    private final Config emptyConfig = ConfigFactory.empty();

    @Test
    void testEnvironmentTakesPrecedence() throws IOException {
        Path dotEnv = tempDir.resolve(".env");
        Files.writeString(dotEnv, "OPENAI_API_KEY=sk-from-file\n");
        ApiKeyLoader loader = new ApiKeyLoader(Map.of("OPENAI_API_KEY", "sk-from-env"), dotEnv);

        assertEquals(Optional.of("sk-from-env"), loader.loadOpenAIKey(emptyConfig));
    }

    @Test
    void testDotEnvFile() throws IOException {
        Path dotEnv = tempDir.resolve(".env");
        Files.writeString(dotEnv, "# comment\nOTHER=1\nexport OPENAI_API_KEY=\"sk-quoted\"\n");
        ApiKeyLoader loader = new ApiKeyLoader(Map.of(), dotEnv);

        assertEquals(Optional.of("sk-quoted"), loader.loadOpenAIKey(emptyConfig));
    }

    @Test
    void testConfigurationFallback() {
        Config config = ConfigFactory.parseString("autograder.openai.api-key = \"sk-config\"");
        ApiKeyLoader loader = new ApiKeyLoader(Map.of(), tempDir.resolve("missing.env"));

        assertEquals(Optional.of("sk-config"), loader.loadOpenAIKey(config));
    }

    @Test
    void testPlaceholderIsRejected() {
        Config config = ConfigFactory.parseString("autograder.openai.api-key = \"your-openai-api-key-here\"");
        ApiKeyLoader loader = new ApiKeyLoader(Map.of("OPENAI_API_KEY", "  "), tempDir.resolve("missing.env"));

        assertTrue(loader.loadOpenAIKey(config).isEmpty());
    }
}
