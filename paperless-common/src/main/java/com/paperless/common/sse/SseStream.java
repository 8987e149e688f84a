package com.paperless.common.sse;

import reactor.core.publisher.Flux;

/**
 * In-process fan-out of one event type to many live clients.
 * All operations are non-blocking and safe to call concurrently.
 *
 * @param <T> the event type
 */
public interface SseStream<T> {

    /**
     * Registers a client and returns the endpoint it reads from. Every item published after
     * this call, until {@link #unsubscribe}, is emitted to the endpoint in publish order.
     */
    Flux<T> subscribe(String clientId);

    /**
     * Removes the client and completes its endpoint. Unknown ids are ignored.
     */
    void unsubscribe(String clientId);

    /**
     * Best-effort delivery to every current subscriber. A subscriber that is gone or whose
     * buffer is full misses the item; the caller never sees an error.
     */
    void publish(T item);

    int subscriberCount();
}
