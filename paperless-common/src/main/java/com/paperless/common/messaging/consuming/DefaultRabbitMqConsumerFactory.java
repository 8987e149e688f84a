package com.paperless.common.messaging.consuming;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paperless.common.messaging.RabbitMqContext;
import com.paperless.common.messaging.RabbitMqSchema;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

@Slf4j
public class DefaultRabbitMqConsumerFactory implements RabbitMqConsumerFactory {

    /**
     * One unacknowledged message per consumer: the next delivery waits for ack/nack.
     */
    static final int PREFETCH_COUNT = 1;

    private final RabbitMqContext context;
    private final ObjectMapper objectMapper;

    public DefaultRabbitMqConsumerFactory(RabbitMqContext context, ObjectMapper objectMapper) {
        this.context = context;
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> RabbitMqConsumer<T> createConsumer(String messageTypeTag, Class<T> messageType) throws IOException {
        String queueName = RabbitMqSchema.queueFor(messageTypeTag);

        Channel channel = context.createChannel();
        try {
            channel.basicQos(PREFETCH_COUNT);
        } catch (IOException e) {
            abort(channel);
            throw e;
        }

        log.debug("Created consumer for {} on channel {}", queueName, channel.getChannelNumber());
        return new DefaultRabbitMqConsumer<>(channel, queueName, messageType, objectMapper);
    }

    private void abort(Channel channel) {
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException | TimeoutException e) {
            log.debug("Ignoring error while closing channel after failed setup", e);
        }
    }
}
