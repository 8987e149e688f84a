package com.paperless.genai.service;

/**
 * The summarization provider could not be reached, even after retrying. Worth trying again later.
 */
public class SummarizerUnavailableException extends RuntimeException {

    public SummarizerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
