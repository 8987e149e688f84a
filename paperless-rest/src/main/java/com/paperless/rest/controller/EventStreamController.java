package com.paperless.rest.controller;

import com.paperless.common.message.GenAIEvent;
import com.paperless.common.message.OcrEvent;
import com.paperless.common.sse.SseEventMapper;
import com.paperless.common.sse.SseStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Live result streams. Every request subscribes under a fresh client id and is
 * unsubscribed when the client disconnects or the stream ends.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
public class EventStreamController {

    @Autowired
    private SseStream<OcrEvent> ocrEventStream;

    @Autowired
    private SseStream<GenAIEvent> genAIEventStream;

    @GetMapping(path = "/ocr-results", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> ocrResults() {
        return stream(ocrEventStream, SseEventMapper.ocr());
    }

    @GetMapping(path = "/events/genai", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> genAIEvents() {
        return stream(genAIEventStream, SseEventMapper.genAI());
    }

    private <T> Flux<ServerSentEvent<Object>> stream(SseStream<T> source, SseEventMapper<T> mapper) {
        String clientId = UUID.randomUUID().toString();
        log.debug("SSE client {} connected", clientId);

        return source.subscribe(clientId)
                .map(mapper::toEvent)
                .doFinally(signal -> {
                    source.unsubscribe(clientId);
                    log.debug("SSE client {} disconnected ({})", clientId, signal);
                });
    }
}
