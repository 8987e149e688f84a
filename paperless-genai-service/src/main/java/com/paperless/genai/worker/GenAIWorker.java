package com.paperless.genai.worker;

import com.paperless.common.message.GenAICommand;
import com.paperless.common.message.GenAIEvent;
import com.paperless.common.messaging.MessageRoute;
import com.paperless.common.messaging.consuming.MessageWorker;
import com.paperless.common.messaging.consuming.RabbitMqConsumer;
import com.paperless.common.messaging.consuming.RabbitMqConsumerFactory;
import com.paperless.common.messaging.publishing.RabbitMqPublisher;
import com.paperless.genai.service.SummarizerUnavailableException;
import com.paperless.genai.service.TextSummarizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Consumes summarization commands and answers each with a {@link GenAIEvent}.
 * <p>
 * An unreachable summarizer requeues the command. Any other failure publishes a failure
 * event and discards the command.
 */
@Slf4j
@Component
public class GenAIWorker extends MessageWorker<GenAICommand> {

    static final String SUMMARY_FAILED = "Failed to generate summary";

    private final RabbitMqPublisher publisher;
    private final TextSummarizer summarizer;

    public GenAIWorker(RabbitMqConsumerFactory consumerFactory, RabbitMqPublisher publisher,
                       TextSummarizer summarizer) {
        super(consumerFactory, MessageRoute.GENAI_COMMAND);
        this.publisher = publisher;
        this.summarizer = summarizer;
    }

    @Override
    protected void handle(GenAICommand command, RabbitMqConsumer<GenAICommand> consumer) throws Exception {
        UUID documentId = command.documentId();

        if (command.text() == null || command.text().isBlank()) {
            log.warn("Received GenAI command for document {} with empty text", documentId);
            consumer.ack();
            return;
        }

        log.info("Generating summary for document {}", documentId);

        try {
            Optional<String> summary = summarizer.summarize(command.text())
                    .filter(value -> !value.isEmpty());

            GenAIEvent result = summary
                    .map(value -> GenAIEvent.success(documentId, value))
                    .orElseGet(() -> GenAIEvent.failure(documentId, SUMMARY_FAILED));

            publisher.publishGenAIEvent(result);
            consumer.ack();

            log.info("Processed document {} - summary generated: {}", documentId, summary.isPresent());
        } catch (SummarizerUnavailableException e) {
            log.warn("Transient GenAI failure for document {}, requeueing: {}", documentId, e.getMessage());
            consumer.nack(true);
        } catch (Exception e) {
            log.error("Fatal GenAI failure for document {}, discarding", documentId, e);
            publishFailure(documentId, e.getMessage());
            consumer.nack(false);
        }
    }

    private void publishFailure(UUID documentId, String errorMessage) {
        try {
            publisher.publishGenAIEvent(GenAIEvent.failure(documentId, errorMessage));
        } catch (IOException e) {
            log.error("Failed to publish failure event for document {}", documentId, e);
        }
    }
}
