package com.autograder.adapters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Extractor for typed submissions. Text formats are decoded directly; scanned formats are
 * reported as failures until a recognition engine is plugged in behind {@link TextExtractionAdapter}.
 */
public class PlainTextExtractor implements TextExtractionAdapter {
    private static final Logger logger = LoggerFactory.getLogger(PlainTextExtractor.class);

    private static final Set<String> TEXT_FORMATS = Set.of("txt", "text", "md");

    @Override
    public ExtractionResult extract(byte[] content, String format) {
        String normalized = format == null ? "" : format.toLowerCase();
        if (!TEXT_FORMATS.contains(normalized)) {
            logger.warn("No recognition engine configured for format '{}'", normalized);
            return ExtractionResult.failure("No recognition engine available for format: " + normalized);
        }
        if (content == null || content.length == 0) {
            return ExtractionResult.failure("Empty file");
        }

        String text = new String(content, StandardCharsets.UTF_8);
        // strip a UTF-8 byte order mark left behind by some editors
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return ExtractionResult.success(text, 1.0);
    }
}
