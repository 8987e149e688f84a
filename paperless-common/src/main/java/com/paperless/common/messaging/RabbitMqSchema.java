package com.paperless.common.messaging;

import java.util.Map;

/**
 * Fixed RabbitMQ namespace of the Paperless pipeline: one durable topic exchange,
 * one durable queue per message type and one binding per queue.
 * <p>
 * Queue names follow the {@code <MessageTypeTag>Queue} convention. The tag to queue and
 * tag to routing key tables are spelled out here instead of being derived from class names.
 */
public final class RabbitMqSchema {

    private RabbitMqSchema() {
    }

    // Exchange
    public static final String EXCHANGE = "paperless.exchange";

    // Message type tags
    public static final String OCR_COMMAND = "OcrCommand";
    public static final String OCR_EVENT = "OcrEvent";
    public static final String GENAI_COMMAND = "GenAICommand";
    public static final String GENAI_EVENT = "GenAIEvent";

    // Queue names
    public static final String OCR_COMMAND_QUEUE = "OcrCommandQueue";
    public static final String OCR_EVENT_QUEUE = "OcrEventQueue";
    public static final String GENAI_COMMAND_QUEUE = "GenAICommandQueue";
    public static final String GENAI_EVENT_QUEUE = "GenAIEventQueue";

    // Routing keys
    public static final String OCR_COMMAND_ROUTING = "ocr.command";
    public static final String OCR_EVENT_ROUTING = "ocr.event";
    public static final String GENAI_COMMAND_ROUTING = "genai.command";
    public static final String GENAI_EVENT_ROUTING = "genai.event";

    private static final Map<String, String> QUEUES_BY_TAG = Map.of(
            OCR_COMMAND, OCR_COMMAND_QUEUE,
            OCR_EVENT, OCR_EVENT_QUEUE,
            GENAI_COMMAND, GENAI_COMMAND_QUEUE,
            GENAI_EVENT, GENAI_EVENT_QUEUE
    );

    private static final Map<String, String> ROUTING_KEYS_BY_QUEUE = Map.of(
            OCR_COMMAND_QUEUE, OCR_COMMAND_ROUTING,
            OCR_EVENT_QUEUE, OCR_EVENT_ROUTING,
            GENAI_COMMAND_QUEUE, GENAI_COMMAND_ROUTING,
            GENAI_EVENT_QUEUE, GENAI_EVENT_ROUTING
    );

    /**
     * Resolves the queue bound for a message type tag.
     *
     * @throws IllegalArgumentException if the tag is not part of the schema
     */
    public static String queueFor(String messageTypeTag) {
        String queue = QUEUES_BY_TAG.get(messageTypeTag);
        if (queue == null) {
            throw new IllegalArgumentException("Unknown message type: " + messageTypeTag);
        }
        return queue;
    }

    /**
     * Queue name to routing key, one entry per binding.
     */
    public static Map<String, String> bindings() {
        return ROUTING_KEYS_BY_QUEUE;
    }
}
