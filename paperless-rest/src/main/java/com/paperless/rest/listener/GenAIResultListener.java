package com.paperless.rest.listener;

import com.paperless.common.message.GenAIEvent;
import com.paperless.common.messaging.MessageRoute;
import com.paperless.common.messaging.consuming.MessageWorker;
import com.paperless.common.messaging.consuming.RabbitMqConsumer;
import com.paperless.common.messaging.consuming.RabbitMqConsumerFactory;
import com.paperless.common.sse.SseStream;
import com.paperless.rest.service.DocumentStatusService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

/**
 * Stores generated summaries and forwards summary results, including failures, to the
 * GenAI event stream.
 */
@Slf4j
@Component
public class GenAIResultListener extends MessageWorker<GenAIEvent> {

    private final DocumentStatusService documentStatusService;
    private final SseStream<GenAIEvent> genAIEventStream;

    public GenAIResultListener(RabbitMqConsumerFactory consumerFactory,
                               DocumentStatusService documentStatusService,
                               SseStream<GenAIEvent> genAIEventStream) {
        super(consumerFactory, MessageRoute.GENAI_EVENT);
        this.documentStatusService = documentStatusService;
        this.genAIEventStream = genAIEventStream;
    }

    @Override
    protected void handle(GenAIEvent event, RabbitMqConsumer<GenAIEvent> consumer) throws Exception {
        try {
            if (event.summary() != null && !event.summary().isBlank()) {
                log.info("Received GenAI summary for document {}", event.documentId());

                OffsetDateTime generatedAt = event.generatedAt() != null ? event.generatedAt() : OffsetDateTime.now();
                if (!documentStatusService.updateSummary(event.documentId(), event.summary(), generatedAt)) {
                    // Nothing to attach the summary to; requeueing would not change that.
                    consumer.ack();
                    return;
                }

                genAIEventStream.publish(event);
            } else {
                log.warn("GenAI failed for document {}: {}", event.documentId(),
                        event.errorMessage() != null ? event.errorMessage() : "Unknown error");
                genAIEventStream.publish(event);
            }

            consumer.ack();
        } catch (Exception e) {
            log.error("Error processing GenAI result for document {}", event.documentId(), e);
            consumer.nack();
        }
    }
}
