package com.paperless.common.messaging.consuming;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * Pull-based consumer of one queue with manual acknowledgement.
 * <p>
 * At most one delivery is outstanding at a time: every message returned by
 * {@link #consume()} must be settled with {@link #ack()} or {@link #nack(boolean)}
 * before the broker hands out the next one.
 *
 * <pre>{@code
 * try (RabbitMqConsumer<OcrEvent> consumer = factory.createConsumer(MessageRoute.OCR_EVENT)) {
 *     Iterator<OcrEvent> events = consumer.consume().iterator();
 *     while (events.hasNext()) {
 *         process(events.next());
 *         consumer.ack();
 *     }
 * }
 * }</pre>
 *
 * @param <T> the message type carried by the queue
 */
public interface RabbitMqConsumer<T> extends AutoCloseable {

    /**
     * Starts consuming and returns the blocking sequence of typed messages.
     * The stream ends when the consumer is closed, the broker cancels the consumer or
     * the pulling thread is interrupted. It can only be obtained once per consumer.
     *
     * @throws IOException           if the broker rejects the subscription (e.g. missing queue)
     * @throws IllegalStateException if called a second time
     */
    Stream<T> consume() throws IOException;

    /**
     * Acknowledges the outstanding delivery, removing it from the queue.
     * Does nothing when no delivery is outstanding.
     */
    void ack() throws IOException;

    /**
     * Rejects the outstanding delivery. Does nothing when no delivery is outstanding.
     *
     * @param requeue whether the broker should put the message back on the queue
     */
    void nack(boolean requeue) throws IOException;

    /**
     * Rejects the outstanding delivery and requeues it.
     */
    default void nack() throws IOException {
        nack(true);
    }

    /**
     * Releases the channel. An unsettled delivery is returned to the queue by the broker.
     */
    @Override
    void close();
}
