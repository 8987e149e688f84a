package com.paperless.rest.service;

import com.paperless.common.exception.DocumentNotFoundException;
import com.paperless.common.message.OcrEvent;
import com.paperless.rest.model.TrackedDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class InMemoryDocumentStatusService implements DocumentStatusService {

    private final Map<UUID, TrackedDocument> documents = new ConcurrentHashMap<>();

    @Override
    public TrackedDocument register(UUID id, String fileName, String filePath) {
        TrackedDocument document = TrackedDocument.pending(id, fileName, filePath);
        documents.put(id, document);
        log.debug("Tracking document {} ({})", id, fileName);
        return document;
    }

    @Override
    public Optional<TrackedDocument> find(UUID id) {
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public TrackedDocument get(UUID id) {
        return find(id).orElseThrow(() -> new DocumentNotFoundException(id));
    }

    @Override
    public void discard(UUID id) {
        documents.remove(id);
    }

    @Override
    public Optional<TrackedDocument> applyOcrResult(OcrEvent event) {
        TrackedDocument updated = documents.computeIfPresent(event.jobId(), (id, current) -> {
            if (!current.isPending()) {
                log.info("Document {} already in status {}, ignoring repeated OCR result", id, current.status());
                return current;
            }
            OffsetDateTime processedAt = event.processedAt() != null ? event.processedAt() : OffsetDateTime.now();
            return event.isCompleted() && event.text() != null
                    ? current.ocrCompleted(event.text(), processedAt)
                    : current.ocrFailed(processedAt);
        });

        if (updated == null) {
            log.warn("Document {} not found for OCR result", event.jobId());
            return Optional.empty();
        }

        log.info("Document {} processed with status {}", updated.id(), updated.status());
        return Optional.of(updated);
    }

    @Override
    public boolean updateSummary(UUID id, String summary, OffsetDateTime generatedAt) {
        TrackedDocument updated = documents.computeIfPresent(id, (key, current) -> current.withSummary(summary, generatedAt));
        if (updated == null) {
            log.warn("Document {} not found for GenAI summary update", id);
            return false;
        }

        log.info("Document {} updated with GenAI summary ({} chars)", id, summary.length());
        return true;
    }
}
