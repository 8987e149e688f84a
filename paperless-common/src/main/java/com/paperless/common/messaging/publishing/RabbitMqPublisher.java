package com.paperless.common.messaging.publishing;

import com.paperless.common.message.GenAICommand;
import com.paperless.common.message.GenAIEvent;
import com.paperless.common.message.OcrCommand;
import com.paperless.common.message.OcrEvent;
import com.paperless.common.messaging.RabbitMqSchema;

import java.io.IOException;

/**
 * Publishes JSON messages to the Paperless exchange.
 */
public interface RabbitMqPublisher {

    /**
     * Serializes {@code message} to JSON and publishes it under {@code routingKey}.
     * The broker routes it to every queue bound with a matching key. No publisher confirm
     * is awaited and nothing is retried.
     *
     * @throws IOException if serialization fails or no channel can be opened
     */
    <T> void publish(String routingKey, T message) throws IOException;

    default void publishOcrCommand(OcrCommand command) throws IOException {
        publish(RabbitMqSchema.OCR_COMMAND_ROUTING, command);
    }

    default void publishOcrEvent(OcrEvent event) throws IOException {
        publish(RabbitMqSchema.OCR_EVENT_ROUTING, event);
    }

    default void publishGenAICommand(GenAICommand command) throws IOException {
        publish(RabbitMqSchema.GENAI_COMMAND_ROUTING, command);
    }

    default void publishGenAIEvent(GenAIEvent event) throws IOException {
        publish(RabbitMqSchema.GENAI_EVENT_ROUTING, event);
    }
}
