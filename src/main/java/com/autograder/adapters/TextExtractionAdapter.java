package com.autograder.adapters;

/**
 * Turns the raw bytes of an answer file into text. The recognition algorithm behind it is opaque
 * to the pipeline; only the reported outcome is interpreted.
 */
public interface TextExtractionAdapter {

    /**
     * @param content raw file bytes
     * @param format  declared file type, lower-case extension without the dot (pdf, jpg, txt, ...)
     */
    ExtractionResult extract(byte[] content, String format);
}
