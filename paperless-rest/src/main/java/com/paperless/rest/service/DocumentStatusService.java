package com.paperless.rest.service;

import com.paperless.common.message.OcrEvent;
import com.paperless.rest.model.TrackedDocument;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracks where each submitted document stands. The result listeners write to it and the
 * status endpoint reads from it.
 */
public interface DocumentStatusService {

    TrackedDocument register(UUID id, String fileName, String filePath);

    Optional<TrackedDocument> find(UUID id);

    /**
     * @throws com.paperless.common.exception.DocumentNotFoundException if the id is unknown
     */
    TrackedDocument get(UUID id);

    void discard(UUID id);

    /**
     * Applies an OCR outcome. A completed event with text marks the document completed,
     * anything else marks it failed. A document that already left the pending state keeps
     * its status, so redelivered results are harmless.
     *
     * @return the updated document, or empty if the job id is unknown
     */
    Optional<TrackedDocument> applyOcrResult(OcrEvent event);

    /**
     * @return false if the document is unknown
     */
    boolean updateSummary(UUID id, String summary, OffsetDateTime generatedAt);
}
