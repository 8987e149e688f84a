package com.paperless.common.messaging.consuming;

import com.paperless.common.message.OcrEvent;
import com.paperless.common.messaging.MessageRoute;
import com.paperless.common.messaging.RabbitMqJson;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the MessageWorker pull loop: dispatch, requeue on failure and shutdown.
 */
@ExtendWith(MockitoExtension.class)
class MessageWorkerTest {

    private static final Duration NO_RETRY = Duration.ofMinutes(5);
    private static final Duration FAST_RETRY = Duration.ofMillis(10);

    @Mock
    private RabbitMqConsumerFactory consumerFactory;

    @Mock
    private RabbitMqConsumer<OcrEvent> consumer;

    @Mock
    private RabbitMqConsumer<OcrEvent> replacement;

    private RecordingWorker worker;

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stop();
        }
    }

    @Test
    @DisplayName("Should hand every pulled message to the handler in order")
    void run_shouldDispatchMessages() throws Exception {
        OcrEvent first = OcrEvent.completed(UUID.randomUUID(), "one");
        OcrEvent second = OcrEvent.failed(UUID.randomUUID());
        when(consumerFactory.createConsumer(MessageRoute.OCR_EVENT)).thenReturn(consumer);
        when(consumer.consume()).thenReturn(Stream.of(first, second));

        worker = new RecordingWorker(consumerFactory, 2, false, NO_RETRY);
        worker.start();

        assertTrue(worker.done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(first, second), worker.handled);
        verify(consumer, times(2)).ack();
        verify(consumer, timeout(2000)).close();
    }

    @Test
    @DisplayName("Should requeue a message whose handler throws")
    void run_shouldNackWhenHandlerFails() throws Exception {
        when(consumerFactory.createConsumer(MessageRoute.OCR_EVENT)).thenReturn(consumer);
        when(consumer.consume()).thenReturn(Stream.of(OcrEvent.completed(UUID.randomUUID(), "boom")));

        worker = new RecordingWorker(consumerFactory, 1, true, NO_RETRY);
        worker.start();

        verify(consumer, timeout(2000)).nack(true);
        verify(consumer, never()).ack();
    }

    @Test
    @DisplayName("Should stay idle when the queue is not declared")
    void run_shouldIdleOnMissingQueue() throws Exception {
        when(consumerFactory.createConsumer(MessageRoute.OCR_EVENT)).thenReturn(consumer);
        when(consumer.consume()).thenThrow(new IOException(
                new IllegalStateException("NOT_FOUND - no queue 'OcrEventQueue' in vhost '/'")));

        worker = new RecordingWorker(consumerFactory, 1, false, NO_RETRY);
        worker.start();

        verify(consumer, timeout(2000)).close();
        assertTrue(worker.isRunning());
        assertTrue(worker.handled.isEmpty());
    }

    @Test
    @DisplayName("Should close the consumer and end the loop on stop")
    void stop_shouldCancelBlockedConsumer() throws Exception {
        Channel channel = mock(Channel.class);
        when(channel.isOpen()).thenReturn(true);
        DefaultRabbitMqConsumer<OcrEvent> blocking =
                new DefaultRabbitMqConsumer<>(channel, "OcrEventQueue", OcrEvent.class, RabbitMqJson.mapper());
        when(consumerFactory.createConsumer(MessageRoute.OCR_EVENT)).thenReturn(blocking);

        worker = new RecordingWorker(consumerFactory, 1, false, NO_RETRY);
        worker.start();
        verify(channel, timeout(2000)).basicConsume(eq("OcrEventQueue"), eq(false), any(Consumer.class));

        worker.stop();

        assertFalse(worker.isRunning());
        verify(channel).close();
        assertTrue(worker.handled.isEmpty());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Recovery after the broker drops the consumer
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should open a new consumer when the stream ends while running")
    void run_shouldResubscribeAfterStreamEnds() throws Exception {
        OcrEvent beforeRestart = OcrEvent.completed(UUID.randomUUID(), "before");
        OcrEvent afterRestart = OcrEvent.completed(UUID.randomUUID(), "after");
        when(consumerFactory.createConsumer(MessageRoute.OCR_EVENT)).thenReturn(consumer, replacement);
        when(consumer.consume()).thenReturn(Stream.of(beforeRestart));
        when(replacement.consume()).thenReturn(Stream.of(afterRestart)).thenAnswer(inv -> Stream.empty());

        worker = new RecordingWorker(consumerFactory, 2, false, FAST_RETRY);
        worker.start();

        assertTrue(worker.done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(beforeRestart, afterRestart), worker.handled);
        verify(consumer).close();
        verify(replacement).ack();
        assertTrue(worker.isRunning());
    }

    @Test
    @DisplayName("Should keep retrying while the broker cannot be reached")
    void run_shouldRetryWhenConsumerCannotBeCreated() throws Exception {
        OcrEvent event = OcrEvent.failed(UUID.randomUUID());
        when(consumerFactory.createConsumer(MessageRoute.OCR_EVENT))
                .thenThrow(new IOException("Connection refused"))
                .thenThrow(new IOException("Connection refused"))
                .thenReturn(consumer);
        when(consumer.consume()).thenReturn(Stream.of(event)).thenAnswer(inv -> Stream.empty());

        worker = new RecordingWorker(consumerFactory, 1, false, FAST_RETRY);
        worker.start();

        assertTrue(worker.done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(event), worker.handled);
        verify(consumerFactory, atLeast(3)).createConsumer(MessageRoute.OCR_EVENT);
    }

    private static final class RecordingWorker extends MessageWorker<OcrEvent> {

        private final List<OcrEvent> handled = new CopyOnWriteArrayList<>();
        private final CountDownLatch done;
        private final boolean fail;

        private RecordingWorker(RabbitMqConsumerFactory factory, int expected, boolean fail, Duration retryDelay) {
            super(factory, MessageRoute.OCR_EVENT, retryDelay);
            this.done = new CountDownLatch(expected);
            this.fail = fail;
        }

        @Override
        protected void handle(OcrEvent message, RabbitMqConsumer<OcrEvent> consumer) throws Exception {
            if (fail) {
                throw new IllegalStateException("handler failure");
            }
            handled.add(message);
            consumer.ack();
            done.countDown();
        }
    }
}
