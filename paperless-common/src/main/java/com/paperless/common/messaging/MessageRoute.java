package com.paperless.common.messaging;

import com.paperless.common.message.GenAICommand;
import com.paperless.common.message.GenAIEvent;
import com.paperless.common.message.OcrCommand;
import com.paperless.common.message.OcrEvent;

/**
 * Typed view of one row of {@link RabbitMqSchema}: the message class that travels
 * on a queue together with its tag and routing key.
 */
public record MessageRoute<T>(String tag, Class<T> messageType, String queue, String routingKey) {

    public static final MessageRoute<OcrCommand> OCR_COMMAND = of(RabbitMqSchema.OCR_COMMAND, OcrCommand.class);
    public static final MessageRoute<OcrEvent> OCR_EVENT = of(RabbitMqSchema.OCR_EVENT, OcrEvent.class);
    public static final MessageRoute<GenAICommand> GENAI_COMMAND = of(RabbitMqSchema.GENAI_COMMAND, GenAICommand.class);
    public static final MessageRoute<GenAIEvent> GENAI_EVENT = of(RabbitMqSchema.GENAI_EVENT, GenAIEvent.class);

    private static <T> MessageRoute<T> of(String tag, Class<T> messageType) {
        String queue = RabbitMqSchema.queueFor(tag);
        return new MessageRoute<>(tag, messageType, queue, RabbitMqSchema.bindings().get(queue));
    }
}
