package com.paperless.rest.config;

import com.paperless.common.message.GenAIEvent;
import com.paperless.common.message.OcrEvent;
import com.paperless.common.sse.BroadcastSseStream;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One broadcaster per event type. The result listeners publish into them and the
 * SSE endpoints subscribe to them.
 */
@Configuration
public class SseStreamConfig {

    @Value("${paperless.sse.subscriber-buffer-size:" + BroadcastSseStream.DEFAULT_BUFFER_SIZE + "}")
    private int subscriberBufferSize;

    @Bean
    public BroadcastSseStream<OcrEvent> ocrEventStream() {
        return new BroadcastSseStream<>("ocr-events", subscriberBufferSize);
    }

    @Bean
    public BroadcastSseStream<GenAIEvent> genAIEventStream() {
        return new BroadcastSseStream<>("genai-events", subscriberBufferSize);
    }
}
