package com.paperless.genai.service;

import java.util.Optional;

/**
 * Produces a summary of OCR-extracted document text.
 */
public interface TextSummarizer {

    /**
     * @return the summary, or empty when the input is blank or the provider gave no usable answer
     * @throws SummarizerUnavailableException when the provider stayed unreachable after retrying
     */
    Optional<String> summarize(String text);
}
