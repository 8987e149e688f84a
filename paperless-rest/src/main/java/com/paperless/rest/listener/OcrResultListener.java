package com.paperless.rest.listener;

import com.paperless.common.message.GenAICommand;
import com.paperless.common.message.OcrEvent;
import com.paperless.common.messaging.MessageRoute;
import com.paperless.common.messaging.consuming.MessageWorker;
import com.paperless.common.messaging.consuming.RabbitMqConsumer;
import com.paperless.common.messaging.consuming.RabbitMqConsumerFactory;
import com.paperless.common.messaging.publishing.RabbitMqPublisher;
import com.paperless.common.sse.SseStream;
import com.paperless.rest.model.TrackedDocument;
import com.paperless.rest.service.DocumentStatusService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Applies OCR results to the tracked documents, requests a summary for successfully
 * extracted text and forwards every result to the OCR event stream.
 * <p>
 * Results for unknown jobs are discarded. Any other failure requeues the result.
 */
@Slf4j
@Component
public class OcrResultListener extends MessageWorker<OcrEvent> {

    private final DocumentStatusService documentStatusService;
    private final RabbitMqPublisher publisher;
    private final SseStream<OcrEvent> ocrEventStream;

    public OcrResultListener(RabbitMqConsumerFactory consumerFactory,
                             DocumentStatusService documentStatusService,
                             RabbitMqPublisher publisher,
                             SseStream<OcrEvent> ocrEventStream) {
        super(consumerFactory, MessageRoute.OCR_EVENT);
        this.documentStatusService = documentStatusService;
        this.publisher = publisher;
        this.ocrEventStream = ocrEventStream;
    }

    @Override
    protected void handle(OcrEvent result, RabbitMqConsumer<OcrEvent> consumer) throws Exception {
        try {
            log.info("Received OCR result for job {} with status {}", result.jobId(), result.status());

            Optional<TrackedDocument> document = documentStatusService.applyOcrResult(result);
            if (document.isEmpty()) {
                consumer.nack(false);
                return;
            }

            if (result.isCompleted() && result.text() != null && !result.text().isBlank()) {
                publisher.publishGenAICommand(
                        new GenAICommand(result.jobId(), result.text(), document.get().fileName()));
                log.info("Requested summary for document {}", result.jobId());
            }

            ocrEventStream.publish(result);

            consumer.ack();
            log.info("Successfully processed OCR result for job {}", result.jobId());
        } catch (Exception e) {
            log.error("Error processing OCR result for job {}", result.jobId(), e);
            consumer.nack();
        }
    }
}
