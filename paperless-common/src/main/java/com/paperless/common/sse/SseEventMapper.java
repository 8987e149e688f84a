package com.paperless.common.sse;

import com.paperless.common.message.GenAIEvent;
import com.paperless.common.message.OcrEvent;
import org.springframework.http.codec.ServerSentEvent;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Turns stream items into SSE frames: {@code event:<type>} picked by a predicate over the
 * item and {@code data:<json>} carrying the payload.
 */
public class SseEventMapper<T> {

    private final Predicate<T> succeeded;
    private final String completedEvent;
    private final String failedEvent;
    private final Function<T, Object> payloadSelector;

    public SseEventMapper(Predicate<T> succeeded, String completedEvent, String failedEvent,
                          Function<T, Object> payloadSelector) {
        this.succeeded = succeeded;
        this.completedEvent = completedEvent;
        this.failedEvent = failedEvent;
        this.payloadSelector = payloadSelector;
    }

    public static SseEventMapper<OcrEvent> ocr() {
        return new SseEventMapper<>(OcrEvent::isCompleted, "ocr-completed", "ocr-failed", event -> event);
    }

    public static SseEventMapper<GenAIEvent> genAI() {
        return new SseEventMapper<>(GenAIEvent::isSuccessful, "genai-completed", "genai-failed", event -> event);
    }

    public String eventType(T item) {
        return succeeded.test(item) ? completedEvent : failedEvent;
    }

    public ServerSentEvent<Object> toEvent(T item) {
        return ServerSentEvent.builder(payloadSelector.apply(item))
                .event(eventType(item))
                .build();
    }
}
