package com.paperless.common.message;

import java.util.UUID;

/**
 * Requests a summary of OCR-extracted text. Published after OCR content has been stored.
 */
public record GenAICommand(
        UUID documentId,
        String text,
        String fileName
) {
}
