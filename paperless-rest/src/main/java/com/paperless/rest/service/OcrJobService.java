package com.paperless.rest.service;

import com.paperless.common.exception.MessagePublishException;
import com.paperless.common.message.OcrCommand;
import com.paperless.common.messaging.publishing.RabbitMqPublisher;
import com.paperless.rest.dto.OcrJobRequest;
import com.paperless.rest.model.TrackedDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.UUID;

@Slf4j
@Service
public class OcrJobService {

    @Autowired
    private DocumentStatusService documentStatusService;

    @Autowired
    private RabbitMqPublisher publisher;

    /**
     * Registers the document as pending, then publishes its OCR command.
     * Registration comes first so a fast OCR result always finds the document.
     */
    public TrackedDocument submit(OcrJobRequest request) {
        UUID jobId = UUID.randomUUID();
        TrackedDocument document = documentStatusService.register(jobId, request.fileName(), request.filePath());

        try {
            publisher.publishOcrCommand(new OcrCommand(jobId, request.fileName(), request.filePath()));
        } catch (IOException e) {
            documentStatusService.discard(jobId);
            throw new MessagePublishException("Failed to queue OCR job " + jobId, e);
        }

        log.info("Queued OCR job {} for {}", jobId, request.fileName());
        return document;
    }
}
