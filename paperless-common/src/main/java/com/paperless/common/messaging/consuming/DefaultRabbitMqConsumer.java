package com.paperless.common.messaging.consuming;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Turns the broker's push callbacks into a blocking pull sequence.
 * <p>
 * Deliveries are decoded on the client's dispatch thread and handed to the single reader
 * through a queue. Undecodable payloads are rejected with requeue and never reach the
 * reader. The channel is owned exclusively by this consumer.
 */
@Slf4j
public class DefaultRabbitMqConsumer<T> implements RabbitMqConsumer<T> {

    private final Channel channel;
    private final String queueName;
    private final Class<T> messageType;
    private final ObjectMapper objectMapper;

    private final BlockingQueue<PendingDelivery<T>> deliveries = new LinkedBlockingQueue<>();
    private final PendingDelivery<T> endOfStream = new PendingDelivery<>(null, -1L);

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean ended;

    // Tag of the delivery last handed to the reader and not yet settled
    private volatile Long currentDeliveryTag;

    public DefaultRabbitMqConsumer(Channel channel, String queueName, Class<T> messageType,
                                   ObjectMapper objectMapper) {
        this.channel = channel;
        this.queueName = queueName;
        this.messageType = messageType;
        this.objectMapper = objectMapper;
    }

    @Override
    public Stream<T> consume() throws IOException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Consumer for " + queueName + " has already been started");
        }
        if (closed.get()) {
            return Stream.empty();
        }

        String consumerTag = channel.basicConsume(queueName, false, new DeliveryHandler(channel));
        log.info("Consuming {} from {} (consumer tag {})", messageType.getSimpleName(), queueName, consumerTag);

        return StreamSupport.stream(new DeliverySpliterator(), false);
    }

    @Override
    public void ack() throws IOException {
        Long tag = currentDeliveryTag;
        if (tag == null) {
            return;
        }
        try {
            channel.basicAck(tag, false);
        } catch (ShutdownSignalException e) {
            throw new IOException("Channel for " + queueName + " closed before ack", e);
        }
        currentDeliveryTag = null;
    }

    @Override
    public void nack(boolean requeue) throws IOException {
        Long tag = currentDeliveryTag;
        if (tag == null) {
            return;
        }
        try {
            channel.basicNack(tag, false, requeue);
        } catch (ShutdownSignalException e) {
            throw new IOException("Channel for " + queueName + " closed before nack", e);
        }
        currentDeliveryTag = null;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        signalEnd();

        try {
            if (channel.isOpen()) {
                channel.close();
            }
            log.debug("Consumer channel for {} closed", queueName);
        } catch (AlreadyClosedException e) {
            log.debug("Consumer channel for {} was already closed", queueName);
        } catch (IOException | TimeoutException e) {
            log.warn("Error closing consumer channel for {}", queueName, e);
        }
    }

    boolean hasOutstandingDelivery() {
        return currentDeliveryTag != null;
    }

    private void dispatch(long deliveryTag, byte[] body) throws IOException {
        T message;
        try {
            message = objectMapper.readValue(body, messageType);
        } catch (IOException e) {
            log.warn("Rejecting undecodable delivery {} on {}: {}", deliveryTag, queueName, e.getMessage());
            channel.basicNack(deliveryTag, false, true);
            return;
        }

        if (message == null) {
            // Left unsettled; the broker redelivers it once this channel closes.
            log.warn("Dropping empty delivery {} on {}", deliveryTag, queueName);
            return;
        }

        deliveries.offer(new PendingDelivery<>(message, deliveryTag));
    }

    private void signalEnd() {
        ended = true;
        deliveries.offer(endOfStream);
    }

    private PendingDelivery<T> awaitNext() {
        if (ended) {
            return null;
        }
        try {
            PendingDelivery<T> next = deliveries.take();
            return next == endOfStream || ended ? null : next;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private record PendingDelivery<M>(M message, long deliveryTag) {
    }

    private final class DeliverySpliterator extends Spliterators.AbstractSpliterator<T> {

        private DeliverySpliterator() {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
        }

        @Override
        public boolean tryAdvance(Consumer<? super T> action) {
            PendingDelivery<T> next = awaitNext();
            if (next == null) {
                return false;
            }
            currentDeliveryTag = next.deliveryTag();
            action.accept(next.message());
            return true;
        }
    }

    private final class DeliveryHandler extends DefaultConsumer {

        private DeliveryHandler(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
                                   byte[] body) throws IOException {
            dispatch(envelope.getDeliveryTag(), body);
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warn("Consumer {} on {} was cancelled by the broker", consumerTag, queueName);
            signalEnd();
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            if (!closed.get()) {
                log.warn("Channel for {} shut down: {}", queueName, sig.getMessage());
            }
            signalEnd();
        }
    }
}
