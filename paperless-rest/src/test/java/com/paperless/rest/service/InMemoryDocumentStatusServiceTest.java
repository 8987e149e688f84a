package com.paperless.rest.service;

import com.paperless.common.exception.DocumentNotFoundException;
import com.paperless.common.message.OcrEvent;
import com.paperless.common.message.OcrStatus;
import com.paperless.rest.model.DocumentStatus;
import com.paperless.rest.model.TrackedDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDocumentStatusServiceTest {

    private final InMemoryDocumentStatusService service = new InMemoryDocumentStatusService();

    private final UUID id = UUID.randomUUID();

    @Test
    @DisplayName("Should register new documents as OCR pending")
    void register_shouldStartPending() {
        service.register(id, "scan.pdf", "uploads/scan.pdf");

        TrackedDocument document = service.get(id);
        assertEquals(DocumentStatus.OCR_PENDING, document.status());
        assertEquals("scan.pdf", document.fileName());
        assertNotNull(document.createdAt());
    }

    @Test
    @DisplayName("Should throw for unknown documents")
    void get_shouldThrowForUnknown() {
        assertThrows(DocumentNotFoundException.class, () -> service.get(id));
        assertTrue(service.find(id).isEmpty());
    }

    @Test
    @DisplayName("Should complete a pending document with extracted text")
    void applyOcrResult_shouldComplete() {
        service.register(id, "scan.pdf", "uploads/scan.pdf");

        Optional<TrackedDocument> updated = service.applyOcrResult(OcrEvent.completed(id, "Hello"));

        assertTrue(updated.isPresent());
        assertEquals(DocumentStatus.OCR_COMPLETED, updated.get().status());
        assertEquals("Hello", updated.get().content());
        assertNotNull(updated.get().processedAt());
    }

    @Test
    @DisplayName("Should fail a document when OCR completed without text")
    void applyOcrResult_shouldFailWithoutText() {
        service.register(id, "scan.pdf", "uploads/scan.pdf");

        OcrEvent event = new OcrEvent(id, OcrStatus.COMPLETED, null, OffsetDateTime.now());

        assertEquals(DocumentStatus.OCR_FAILED, service.applyOcrResult(event).get().status());
    }

    @Test
    @DisplayName("Should keep the first outcome when a result is redelivered")
    void applyOcrResult_shouldIgnoreRepeatedResult() {
        service.register(id, "scan.pdf", "uploads/scan.pdf");
        service.applyOcrResult(OcrEvent.completed(id, "first"));

        TrackedDocument again = service.applyOcrResult(OcrEvent.failed(id)).orElseThrow();

        assertEquals(DocumentStatus.OCR_COMPLETED, again.status());
        assertEquals("first", again.content());
    }

    @Test
    @DisplayName("Should report unknown jobs as empty")
    void applyOcrResult_shouldReturnEmptyForUnknown() {
        assertTrue(service.applyOcrResult(OcrEvent.failed(id)).isEmpty());
    }

    @Test
    @DisplayName("Should attach summaries to known documents only")
    void updateSummary_shouldUpdateKnownDocument() {
        OffsetDateTime generatedAt = OffsetDateTime.now();
        service.register(id, "scan.pdf", "uploads/scan.pdf");

        assertTrue(service.updateSummary(id, "Summary", generatedAt));
        assertFalse(service.updateSummary(UUID.randomUUID(), "Summary", generatedAt));

        TrackedDocument document = service.get(id);
        assertEquals("Summary", document.summary());
        assertEquals(generatedAt, document.summaryGeneratedAt());
    }

    @Test
    @DisplayName("Should forget discarded documents")
    void discard_shouldRemove() {
        service.register(id, "scan.pdf", "uploads/scan.pdf");
        service.discard(id);

        assertTrue(service.find(id).isEmpty());
    }
}
