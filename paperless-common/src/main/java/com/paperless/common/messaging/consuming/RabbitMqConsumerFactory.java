package com.paperless.common.messaging.consuming;

import com.paperless.common.messaging.MessageRoute;

import java.io.IOException;

/**
 * Creates consumers bound to the queues of the Paperless schema.
 */
public interface RabbitMqConsumerFactory {

    /**
     * Creates a consumer on its own channel with a prefetch of one message.
     *
     * @param messageTypeTag tag of the message type, e.g. {@code "OcrEvent"}
     * @param messageType    class the payload is deserialized into
     * @throws IllegalArgumentException if the tag is unknown
     * @throws IOException              if no channel can be opened
     */
    <T> RabbitMqConsumer<T> createConsumer(String messageTypeTag, Class<T> messageType) throws IOException;

    default <T> RabbitMqConsumer<T> createConsumer(MessageRoute<T> route) throws IOException {
        return createConsumer(route.tag(), route.messageType());
    }
}
