package com.paperless.common.messaging.publishing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paperless.common.messaging.RabbitMqContext;
import com.paperless.common.messaging.RabbitMqSchema;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Opens a short-lived channel per publish so concurrent callers never share one.
 */
@Slf4j
public class DefaultRabbitMqPublisher implements RabbitMqPublisher {

    private final RabbitMqContext context;
    private final ObjectMapper objectMapper;

    public DefaultRabbitMqPublisher(RabbitMqContext context, ObjectMapper objectMapper) {
        this.context = context;
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> void publish(String routingKey, T message) throws IOException {
        Objects.requireNonNull(message, "message");
        byte[] body = objectMapper.writeValueAsBytes(message);

        try (Channel channel = context.createChannel()) {
            channel.basicPublish(RabbitMqSchema.EXCHANGE, routingKey, null, body);
        } catch (ShutdownSignalException e) {
            throw new IOException("RabbitMQ channel closed while publishing to " + routingKey, e);
        } catch (TimeoutException e) {
            throw new IOException("Timed out closing publish channel", e);
        }

        log.debug("Published {} ({} bytes) to {} with routing key {}",
                message.getClass().getSimpleName(), body.length, RabbitMqSchema.EXCHANGE, routingKey);
    }
}
