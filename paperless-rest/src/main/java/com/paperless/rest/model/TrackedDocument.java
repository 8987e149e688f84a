package com.paperless.rest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Snapshot of a document's progress through OCR and summarization.
 * Instances are immutable; every transition returns a new snapshot.
 */
public record TrackedDocument(
        UUID id,
        String fileName,
        String filePath,
        DocumentStatus status,
        OffsetDateTime createdAt,
        String content,
        OffsetDateTime processedAt,
        String summary,
        OffsetDateTime summaryGeneratedAt
) {

    public static TrackedDocument pending(UUID id, String fileName, String filePath) {
        return new TrackedDocument(id, fileName, filePath, DocumentStatus.OCR_PENDING, OffsetDateTime.now(),
                null, null, null, null);
    }

    public TrackedDocument ocrCompleted(String extractedText, OffsetDateTime at) {
        return new TrackedDocument(id, fileName, filePath, DocumentStatus.OCR_COMPLETED, createdAt,
                extractedText, at, summary, summaryGeneratedAt);
    }

    public TrackedDocument ocrFailed(OffsetDateTime at) {
        return new TrackedDocument(id, fileName, filePath, DocumentStatus.OCR_FAILED, createdAt,
                null, at, summary, summaryGeneratedAt);
    }

    public TrackedDocument withSummary(String newSummary, OffsetDateTime generatedAt) {
        return new TrackedDocument(id, fileName, filePath, status, createdAt,
                content, processedAt, newSummary, generatedAt);
    }

    @JsonIgnore
    public boolean isPending() {
        return status == DocumentStatus.OCR_PENDING;
    }
}
