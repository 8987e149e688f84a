package com.paperless.common.sse;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SseStream} backed by one bounded unicast sink per client.
 * <p>
 * The registry is a {@link ConcurrentHashMap}; publishing walks its live view without a
 * global lock, so subscribe and unsubscribe are never held up by a slow fan-out. Emission
 * into a single sink is serialized on that sink only.
 */
@Slf4j
public class BroadcastSseStream<T> implements SseStream<T>, DisposableBean {

    public static final int DEFAULT_BUFFER_SIZE = 256;

    private final String name;
    private final int bufferSize;

    // clientId -> outbound sink
    private final Map<String, Sinks.Many<T>> subscribers = new ConcurrentHashMap<>();

    public BroadcastSseStream(String name) {
        this(name, DEFAULT_BUFFER_SIZE);
    }

    public BroadcastSseStream(String name, int bufferSize) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
        this.name = name;
        this.bufferSize = bufferSize;
    }

    @Override
    public Flux<T> subscribe(String clientId) {
        Sinks.Many<T> sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<T>get(bufferSize).get());

        Sinks.Many<T> previous = subscribers.put(clientId, sink);
        if (previous != null) {
            complete(previous);
        }

        log.debug("[{}] Client {} subscribed ({} active)", name, clientId, subscribers.size());
        return sink.asFlux();
    }

    @Override
    public void unsubscribe(String clientId) {
        Sinks.Many<T> sink = subscribers.remove(clientId);
        if (sink == null) {
            return;
        }
        complete(sink);
        log.debug("[{}] Client {} unsubscribed ({} active)", name, clientId, subscribers.size());
    }

    @Override
    public void publish(T item) {
        for (Map.Entry<String, Sinks.Many<T>> entry : subscribers.entrySet()) {
            Sinks.EmitResult result;
            Sinks.Many<T> sink = entry.getValue();
            synchronized (sink) {
                result = sink.tryEmitNext(item);
            }

            if (result.isFailure()) {
                if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
                    log.warn("[{}] Buffer full for client {}, dropping event", name, entry.getKey());
                } else {
                    log.debug("[{}] Could not deliver to client {}: {}", name, entry.getKey(), result);
                }
            }
        }
    }

    @Override
    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Completes every endpoint and clears the registry.
     */
    public void completeAll() {
        log.info("[{}] Closing {} subscriber streams", name, subscribers.size());
        subscribers.keySet().forEach(this::unsubscribe);
    }

    @Override
    public void destroy() {
        completeAll();
    }

    private void complete(Sinks.Many<T> sink) {
        synchronized (sink) {
            sink.tryEmitComplete();
        }
    }
}
