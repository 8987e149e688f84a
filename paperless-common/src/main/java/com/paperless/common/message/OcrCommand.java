package com.paperless.common.message;

import java.util.UUID;

/**
 * Requests OCR extraction for a stored file.
 * Published on {@code ocr.command}; answered by an {@link OcrEvent} with the same job id.
 */
public record OcrCommand(
        UUID jobId,
        String fileName,
        String filePath // Location of the file in object storage
) {
}
