package com.paperless.common.messaging.consuming;

import com.paperless.common.messaging.MessageRoute;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.io.IOException;
import java.time.Duration;
import java.util.Iterator;

/**
 * Background loop that pulls one queue and hands each message to {@link #handle}.
 * <p>
 * The handler settles the delivery itself through the consumer it is given. A handler
 * exception that escapes is logged and the delivery is requeued, so a failing message is
 * never lost. A stream that ends while the worker is running (channel or connection lost)
 * is replaced by a new consumer after a doubling delay of up to 30 seconds. Stopping the
 * worker closes the consumer, which ends the pull loop; whatever delivery was in flight is
 * returned to the queue by the broker.
 */
@Slf4j
public abstract class MessageWorker<T> implements SmartLifecycle {

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    private static final Duration MAX_RETRY_DELAY = Duration.ofSeconds(30);

    private final RabbitMqConsumerFactory consumerFactory;
    private final MessageRoute<T> route;
    private final Duration initialRetryDelay;

    private volatile Thread thread;
    private volatile RabbitMqConsumer<T> consumer;
    private volatile boolean running;

    protected MessageWorker(RabbitMqConsumerFactory consumerFactory, MessageRoute<T> route) {
        this(consumerFactory, route, DEFAULT_RETRY_DELAY);
    }

    MessageWorker(RabbitMqConsumerFactory consumerFactory, MessageRoute<T> route, Duration initialRetryDelay) {
        this.consumerFactory = consumerFactory;
        this.route = route;
        this.initialRetryDelay = initialRetryDelay;
    }

    /**
     * Processes one message and settles it with exactly one of ack or nack.
     */
    protected abstract void handle(T message, RabbitMqConsumer<T> consumer) throws Exception;

    protected String workerName() {
        return getClass().getSimpleName();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this::run, workerName());
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        RabbitMqConsumer<T> current = consumer;
        if (current != null) {
            current.close();
        }

        Thread worker = thread;
        if (worker != null) {
            worker.interrupt();
            try {
                worker.join(STOP_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("{} stopped", workerName());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void run() {
        log.info("{} started on {}", workerName(), route.queue());

        Duration delay = initialRetryDelay;
        while (running) {
            boolean delivered = false;
            try {
                delivered = consumeUntilEnd();
            } catch (IOException | RuntimeException e) {
                if (isMissingQueue(e)) {
                    log.warn("{} disabled - queue {} is not declared on the broker", workerName(), route.queue());
                    break;
                }
                if (running) {
                    log.error("{} failed on {}", workerName(), route.queue(), e);
                }
            }

            if (!running) {
                break;
            }
            if (delivered) {
                delay = initialRetryDelay;
            }
            log.warn("{} lost its consumer on {}, resubscribing in {} ms", workerName(), route.queue(), delay.toMillis());
            if (!pause(delay)) {
                break;
            }
            delay = nextDelay(delay);
        }

        log.info("{} finished consuming {}", workerName(), route.queue());
    }

    /**
     * Pulls one consumer until its stream ends.
     *
     * @return true if at least one message was handled
     */
    private boolean consumeUntilEnd() throws IOException {
        try (RabbitMqConsumer<T> created = consumerFactory.createConsumer(route)) {
            consumer = created;
            if (!running) {
                return false;
            }

            boolean delivered = false;
            Iterator<T> messages = created.consume().iterator();
            while (running && messages.hasNext()) {
                process(messages.next(), created);
                delivered = true;
            }
            return delivered;
        } finally {
            consumer = null;
        }
    }

    private boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return running;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Duration nextDelay(Duration delay) {
        Duration doubled = delay.multipliedBy(2);
        return doubled.compareTo(MAX_RETRY_DELAY) > 0 ? MAX_RETRY_DELAY : doubled;
    }

    private void process(T message, RabbitMqConsumer<T> current) {
        try {
            handle(message, current);
        } catch (Exception e) {
            log.error("{} failed to handle {}, requeueing", workerName(), route.tag(), e);
            try {
                current.nack(true);
            } catch (IOException nackError) {
                log.error("{} could not nack {}", workerName(), route.tag(), nackError);
            }
        }
    }

    private static boolean isMissingQueue(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.contains("no queue")) {
                return true;
            }
        }
        return false;
    }
}
